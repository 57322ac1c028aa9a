package org.dxworks.thesisdoc.model.document;

import java.util.Locale;
import java.util.Optional;

public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    /**
     * Parses an alignment name as written in a style config. {@code START} is an
     * alias of {@code LEFT}.
     */
    public static Optional<Alignment> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("START")) {
            return Optional.of(LEFT);
        }
        for (Alignment alignment : values()) {
            if (alignment.name().equals(normalized)) {
                return Optional.of(alignment);
            }
        }
        return Optional.empty();
    }
}
