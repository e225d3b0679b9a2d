package net.modshub.service.index;

import java.util.Objects;
import java.util.Optional;
import net.modshub.repository.KeyValueStore;

/**
 * Global {@code slug -> modId} reservations, one per slug, regardless of visibility.
 *
 * <p>Reservation is a single conditional insert; no read-then-write happens here, so
 * two concurrent claims on the same slug cannot both succeed.</p>
 */
public class SlugReservationIndex {

    private final KeyValueStore store;

    public SlugReservationIndex(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Claims {@code slug} for {@code modId}. Claiming a slug the mod already holds
     * succeeds, so a replayed claim is harmless.
     */
    public ReservationResult reserve(String slug, String modId) {
        Optional<String> holder = store.putIfAbsent(slug, modId);
        if (holder.isEmpty()) {
            return ReservationResult.reserved();
        }
        if (holder.get().equals(modId)) {
            return ReservationResult.alreadyOwned();
        }
        return ReservationResult.conflict(holder.get());
    }

    public Optional<String> lookup(String slug) {
        return store.get(slug);
    }

    public boolean isHeldBy(String slug, String modId) {
        return lookup(slug).filter(modId::equals).isPresent();
    }

    /**
     * Drops the reservation only while it still belongs to {@code modId}.
     */
    public boolean release(String slug, String modId) {
        return store.deleteIfValue(slug, modId);
    }

    public String namespace() {
        return store.namespace();
    }

    /**
     * Outcome of a reservation attempt.
     *
     * @param outcome what happened
     * @param holderModId mod holding the slug when {@code outcome} is CONFLICT, else null
     */
    public record ReservationResult(Outcome outcome, String holderModId) {

        public enum Outcome {
            RESERVED,
            ALREADY_OWNED,
            CONFLICT
        }

        static ReservationResult reserved() {
            return new ReservationResult(Outcome.RESERVED, null);
        }

        static ReservationResult alreadyOwned() {
            return new ReservationResult(Outcome.ALREADY_OWNED, null);
        }

        static ReservationResult conflict(String holderModId) {
            return new ReservationResult(Outcome.CONFLICT, holderModId);
        }

        public boolean isConflict() {
            return outcome == Outcome.CONFLICT;
        }
    }
}
