package net.modshub.controller.dto;

import net.modshub.domain.Mod;

/**
 * {@code {"mod": {...}}}, the single-mod response body.
 */
public record ModEnvelope(ModResponse mod) {

    public static ModEnvelope of(Mod mod) {
        return new ModEnvelope(ModResponse.from(mod));
    }
}
