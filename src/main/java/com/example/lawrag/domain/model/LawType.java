package com.example.lawrag.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum LawType {
    CRIMINAL,
    CIVIL,
    COMMERCIAL,
    ECONOMIC,
    ADMINISTRATIVE,
    ARBITRATION,
    LABOR,
    PERSONAL_STATUS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LawType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.code().equals(normalized)).findFirst();
    }
}
