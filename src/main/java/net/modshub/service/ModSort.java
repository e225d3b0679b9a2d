package net.modshub.service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import net.modshub.domain.Mod;

/**
 * Listing orders. Ties fall back to the mod id so pages stay stable.
 */
public enum ModSort {
    NEWEST(Comparator.comparing(Mod::getCreatedAt).reversed()),
    OLDEST(Comparator.comparing(Mod::getCreatedAt)),
    TITLE(Comparator.comparing((Mod mod) -> mod.getTitle().toLowerCase(Locale.ROOT)));

    private final Comparator<Mod> comparator;

    ModSort(Comparator<Mod> comparator) {
        this.comparator = comparator.thenComparing(Mod::getModId);
    }

    public Comparator<Mod> comparator() {
        return comparator;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModSort> fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(candidate -> candidate.wireValue().equals(value))
            .findFirst();
    }
}
