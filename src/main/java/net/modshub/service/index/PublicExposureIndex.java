package net.modshub.service.index;

import java.util.Objects;
import java.util.Optional;
import net.modshub.repository.KeyValueStore;

/**
 * {@code slug -> modId} entries for public mods only; the sole slug index anonymous
 * callers are allowed to hit. Every operation is idempotent and conditional: an entry
 * is never overwritten, and only its own mod removes it.
 */
public class PublicExposureIndex {

    private final KeyValueStore store;

    public PublicExposureIndex(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Exposes {@code slug} for {@code modId} unless another mod's entry is in the way.
     *
     * @return empty when the slug is now exposed for {@code modId}, otherwise the mod id
     *         that already holds the exposure
     */
    public Optional<String> expose(String slug, String modId) {
        return store.putIfAbsent(slug, modId).filter(holder -> !holder.equals(modId));
    }

    public Optional<String> lookup(String slug) {
        return store.get(slug);
    }

    /**
     * Removes the exposure if it belongs to {@code modId}; absence is not an error.
     */
    public boolean withdraw(String slug, String modId) {
        return store.deleteIfValue(slug, modId);
    }

    public String namespace() {
        return store.namespace();
    }
}
