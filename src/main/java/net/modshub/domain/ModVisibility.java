package net.modshub.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Who may see a mod. Only {@link #PUBLIC} mods are anonymously resolvable by slug.
 */
public enum ModVisibility {
    PUBLIC,
    UNLISTED,
    PRIVATE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModVisibility> fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(candidate -> candidate.wireValue().equals(value))
            .findFirst();
    }
}
