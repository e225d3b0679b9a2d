package net.modshub.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ModCategory {
    SCRIPT,
    OVERLAY,
    THEME,
    ASSET,
    PLUGIN,
    OTHER;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModCategory> fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(candidate -> candidate.wireValue().equals(value))
            .findFirst();
    }
}
