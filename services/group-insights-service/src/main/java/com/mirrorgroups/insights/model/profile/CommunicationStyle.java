package com.mirrorgroups.insights.model.profile;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum CommunicationStyle {
    DIRECT,
    SUPPORTIVE,
    ANALYTICAL,
    INDIRECT;

    public static Optional<CommunicationStyle> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(style -> style.name().equals(normalized))
            .findFirst();
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
