package net.modshub.repository;

import java.util.List;
import java.util.Optional;
import net.modshub.domain.Mod;

/**
 * Primary record store keyed by mod id. Knows nothing about slug uniqueness.
 */
public interface ModRepository {

    Optional<Mod> findById(String modId);

    /**
     * Stores a new record.
     *
     * @throws org.springframework.dao.DuplicateKeyException when the id is already stored
     */
    void insert(Mod mod);

    /**
     * Replaces {@code expected} with {@code updated} only while the stored record is still
     * at {@code expected.getVersion()}. {@code updated} must carry the next version.
     *
     * @return false when the record changed or disappeared since {@code expected} was read
     */
    boolean replace(Mod expected, Mod updated);

    /** @return true when a record was removed */
    boolean deleteById(String modId);

    List<Mod> findAll();
}
