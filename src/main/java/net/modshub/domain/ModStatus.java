package net.modshub.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Moderation state. Independent of visibility and of slug reservation.
 */
public enum ModStatus {
    DRAFT,
    PENDING,
    APPROVED,
    CHANGES_REQUESTED,
    DENIED,
    PUBLISHED,
    ARCHIVED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModStatus> fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(candidate -> candidate.wireValue().equals(value))
            .findFirst();
    }
}
