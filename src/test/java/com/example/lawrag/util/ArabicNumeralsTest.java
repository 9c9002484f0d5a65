package com.example.lawrag.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ArabicNumeralsTest {

    @Test
    void convertsBetweenScripts() {
        assertEquals("مادة 305", ArabicNumerals.toWestern("مادة ٣٠٥"));
        assertEquals("جزء ٢ من ٣", ArabicNumerals.toArabicIndic("جزء 2 من 3"));
        assertEquals("١٠", ArabicNumerals.toArabicIndic(10));
    }

    @Test
    void parsesEitherScript() {
        assertEquals(OptionalInt.of(42), ArabicNumerals.parse("٤٢"));
        assertEquals(OptionalInt.of(42), ArabicNumerals.parse("42"));
        assertTrue(ArabicNumerals.parse("4x").isEmpty());
        assertTrue(ArabicNumerals.parse("").isEmpty());
    }

    @Test
    void reversedReadingOnlyForMultiDigitNonPalindromes() {
        assertEquals(OptionalInt.of(21), ArabicNumerals.reversed("12"));
        assertEquals(OptionalInt.of(1), ArabicNumerals.reversed("10"));
        assertTrue(ArabicNumerals.reversed("7").isEmpty());
        assertTrue(ArabicNumerals.reversed("11").isEmpty());
    }

    @Test
    void extractsFirstNumberWithReverse() {
        ArabicNumerals.NumberReading reading = ArabicNumerals.extractNumberWithReverse("المادة ١٢ من القانون 5");
        assertEquals(12, reading.value());
        assertEquals(21, reading.reversedValue());

        ArabicNumerals.NumberReading single = ArabicNumerals.extractNumberWithReverse("مادة 3");
        assertEquals(3, single.value());
        assertNull(single.reversedValue());

        assertNull(ArabicNumerals.extractNumberWithReverse("لا أرقام هنا"));
    }

    @Test
    void formatsArticleLabel() {
        assertEquals("مادة 318", ArabicNumerals.formatArticleLabel(318));
    }
}
