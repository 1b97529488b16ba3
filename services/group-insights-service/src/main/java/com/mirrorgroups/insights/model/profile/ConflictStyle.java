package com.mirrorgroups.insights.model.profile;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Thomas-Kilmann conflict resolution modes
 */
public enum ConflictStyle {
    COMPETING,
    COLLABORATING,
    COMPROMISING,
    AVOIDING,
    ACCOMMODATING;

    public static Optional<ConflictStyle> fromValue(String value) {
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
