package com.example.lawrag.util;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Orthographic normalization for Arabic legal text.
 *
 * <p>Teh marbuta and alef maksura are kept apart unless asked for: in statutes they can change
 * which word is meant, so only the search tokenizer folds them.
 */
public final class ArabicNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("[\\u064B-\\u065F\\u0670]");
    private static final Pattern TATWEEL = Pattern.compile("\\u0640");
    private static final Pattern ALEF_VARIANTS = Pattern.compile("[\\u0623\\u0625\\u0622\\u0671]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");

    private ArabicNormalizer() {
    }

    public record Options(boolean removeDiacritics,
                          boolean removeTatweel,
                          boolean normalizeAlef,
                          boolean normalizeTehMarbuta,
                          boolean normalizeAlefMaksura) {

        public static final Options QUERY = new Options(true, true, true, false, false);
        public static final Options SEARCH = new Options(true, true, true, true, true);
        public static final Options DISPLAY = new Options(false, true, false, false, false);
    }

    public static String normalize(String text, Options options) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String out = text;
        if (options.removeDiacritics()) {
            out = DIACRITICS.matcher(out).replaceAll("");
        }
        if (options.removeTatweel()) {
            out = TATWEEL.matcher(out).replaceAll("");
        }
        if (options.normalizeAlef()) {
            out = ALEF_VARIANTS.matcher(out).replaceAll("ا");
        }
        if (options.normalizeTehMarbuta()) {
            out = out.replace('ة', 'ه');
        }
        if (options.normalizeAlefMaksura()) {
            out = out.replace('ى', 'ي');
        }
        return WHITESPACE.matcher(out).replaceAll(" ").trim();
    }

    public static String normalizeForQuery(String text) {
        return normalize(text, Options.QUERY);
    }

    public static String normalizeForSearch(String text) {
        return normalize(text, Options.SEARCH);
    }

    public static String normalizeForDisplay(String text) {
        return normalize(text, Options.DISPLAY);
    }

    /**
     * Cleans one extracted line: folds presentation forms (NFKC), drops tatweel and squeezes
     * horizontal whitespace. Never joins lines.
     */
    public static String normalizeExtractedLine(String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        String out = Normalizer.normalize(line, Normalizer.Form.NFKC);
        out = TATWEEL.matcher(out).replaceAll("");
        return HORIZONTAL_SPACE.matcher(out).replaceAll(" ").trim();
    }
}
