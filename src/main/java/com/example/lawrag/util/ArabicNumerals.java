package com.example.lawrag.util;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between Arabic-Indic digits (٠-٩) and ASCII digits, plus the helpers used when
 * article numbers come out of a PDF with their digits in reverse order.
 */
public final class ArabicNumerals {

    private static final char ARABIC_INDIC_ZERO = '٠';
    private static final Pattern NUMBER = Pattern.compile("[٠-٩0-9]+");

    private ArabicNumerals() {
    }

    public static boolean isArabicIndicDigit(char c) {
        return c >= ARABIC_INDIC_ZERO && c <= ARABIC_INDIC_ZERO + 9;
    }

    public static String toWestern(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(isArabicIndicDigit(c) ? (char) ('0' + (c - ARABIC_INDIC_ZERO)) : c);
        }
        return sb.toString();
    }

    public static String toArabicIndic(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(c >= '0' && c <= '9' ? (char) (ARABIC_INDIC_ZERO + (c - '0')) : c);
        }
        return sb.toString();
    }

    public static String toArabicIndic(int number) {
        return toArabicIndic(Integer.toString(number));
    }

    /**
     * Parses a run of digits in either script. Returns empty for text that is not purely digits
     * or does not fit an int.
     */
    public static OptionalInt parse(String digits) {
        if (digits == null || digits.isEmpty()) {
            return OptionalInt.empty();
        }
        String western = toWestern(digits.trim());
        if (western.isEmpty() || !western.chars().allMatch(Character::isDigit) || western.length() > 9) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(western));
    }

    /**
     * Value of the digit string read backwards, or empty for single digits and palindromes.
     */
    public static OptionalInt reversed(String digits) {
        String western = toWestern(digits == null ? "" : digits.trim());
        if (western.length() < 2) {
            return OptionalInt.empty();
        }
        String flipped = new StringBuilder(western).reverse().toString();
        if (flipped.equals(western)) {
            return OptionalInt.empty();
        }
        return parse(flipped);
    }

    /**
     * First number found in the text, with its digit-reversed reading when it has one.
     */
    public static NumberReading extractNumberWithReverse(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) {
            return null;
        }
        OptionalInt normal = parse(m.group());
        if (normal.isEmpty()) {
            return null;
        }
        OptionalInt rev = reversed(m.group());
        return new NumberReading(normal.getAsInt(), rev.isPresent() ? rev.getAsInt() : null);
    }

    public static String formatArticleLabel(Integer articleNumber) {
        return "مادة " + (articleNumber == null ? "?" : articleNumber);
    }

    public record NumberReading(int value, Integer reversedValue) {
    }
}
