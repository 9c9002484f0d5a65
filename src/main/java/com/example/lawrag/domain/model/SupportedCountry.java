package com.example.lawrag.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SupportedCountry {
    EGYPT("Egypt", "مصر"),
    JORDAN("Jordan", "الأردن"),
    UAE("United Arab Emirates", "الإمارات"),
    SAUDI("Saudi Arabia", "السعودية"),
    KUWAIT("Kuwait", "الكويت");

    private final String displayName;
    private final String arabicName;

    SupportedCountry(String displayName, String arabicName) {
        this.displayName = displayName;
        this.arabicName = arabicName;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getArabicName() {
        return arabicName;
    }

    public static Optional<SupportedCountry> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.code().equals(normalized)).findFirst();
    }
}
