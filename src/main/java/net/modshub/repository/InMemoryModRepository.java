package net.modshub.repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import net.modshub.domain.Mod;
import org.springframework.dao.DuplicateKeyException;

/**
 * Non-persistent {@link ModRepository} used when no datasource is configured.
 * Writes rely on the atomic {@code putIfAbsent} and {@code replace} of {@link ConcurrentMap}.
 */
public class InMemoryModRepository implements ModRepository {

    private final ConcurrentMap<String, Mod> mods = new ConcurrentHashMap<>();

    @Override
    public Optional<Mod> findById(String modId) {
        return Optional.ofNullable(mods.get(modId));
    }

    @Override
    public void insert(Mod mod) {
        if (mods.putIfAbsent(mod.getModId(), mod) != null) {
            throw new DuplicateKeyException("Mod " + mod.getModId() + " already exists");
        }
    }

    @Override
    public boolean replace(Mod expected, Mod updated) {
        if (!expected.getModId().equals(updated.getModId()) || updated.getVersion() != expected.getVersion() + 1) {
            throw new IllegalArgumentException("Replacement of " + expected.getModId() + " must carry the next version");
        }
        return mods.replace(expected.getModId(), expected, updated);
    }

    @Override
    public boolean deleteById(String modId) {
        return mods.remove(modId) != null;
    }

    @Override
    public List<Mod> findAll() {
        return List.copyOf(mods.values());
    }
}
