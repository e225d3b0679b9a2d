package net.modshub.repository;

import java.util.List;
import java.util.Optional;

/**
 * String-keyed store with the conditional primitives the slug indices rely on.
 *
 * <p>Implementations must make {@link #putIfAbsent} linearizable per key: of two
 * concurrent calls for the same absent key, exactly one writes.</p>
 *
 * <p>The slug indices and the write lock only ever use {@link #putIfAbsent} and
 * {@link #deleteIfValue}. {@link #put} and {@link #delete} serve namespaces whose
 * entries have no competing writers, such as uploader approvals.</p>
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Writes {@code key -> value} only if the key is absent.
     *
     * @return empty when this call wrote the entry, otherwise the value already held.
     *         A replay of a successful call returns its own value.
     */
    Optional<String> putIfAbsent(String key, String value);

    /** Unconditional upsert. */
    void put(String key, String value);

    /** @return true when an entry was removed; absence is not an error */
    boolean delete(String key);

    /**
     * Removes the entry only while it still maps to {@code expectedValue}.
     *
     * @return true when an entry was removed
     */
    boolean deleteIfValue(String key, String expectedValue);

    /** All keys of this namespace in ascending order. */
    List<String> keys();

    /** Short label for logs and health output, e.g. {@code reservation}. */
    String namespace();
}
