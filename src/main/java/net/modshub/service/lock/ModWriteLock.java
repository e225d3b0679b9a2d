package net.modshub.service.lock;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import net.modshub.exception.ConcurrentModUpdateException;
import net.modshub.repository.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Per-mod write lease held in a key-value namespace, so that two writes to the same mod
 * never interleave their slug index changes.
 *
 * <p>A lease is a {@code modId -> <acquiredAtMillis>_<uuid>} entry taken with a conditional
 * insert and dropped with a conditional delete. A lease older than the configured timeout
 * belongs to a writer that died and may be taken over. Acquisition retries with linear
 * backoff ({@code baseBackoff * attempt}) and gives up with
 * {@link ConcurrentModUpdateException}.</p>
 */
public class ModWriteLock {

    private static final Logger log = LoggerFactory.getLogger(ModWriteLock.class);

    private final KeyValueStore store;
    private final Clock clock;
    private final Duration leaseTimeout;
    private final int maxAttempts;
    private final Duration baseBackoff;

    public ModWriteLock(KeyValueStore store, Clock clock, Duration leaseTimeout, int maxAttempts, Duration baseBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "leaseTimeout");
        this.maxAttempts = maxAttempts;
        this.baseBackoff = Objects.requireNonNull(baseBackoff, "baseBackoff");
    }

    /**
     * Takes the lease for {@code modId}; close the returned lease to give it back.
     *
     * @throws ConcurrentModUpdateException when another writer keeps holding the lease
     */
    public Lease acquire(String modId) {
        String token = clock.millis() + "_" + UUID.randomUUID();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<String> holder = store.putIfAbsent(modId, token);
            if (holder.isEmpty() || holder.get().equals(token)) {
                return new Lease(modId, token);
            }
            if (isExpired(holder.get())) {
                log.warn("Taking over expired write lease on mod {} (held since {})", modId, holder.get());
                store.deleteIfValue(modId, holder.get());
                continue;
            }
            if (attempt < maxAttempts) {
                long backoff = Math.max(baseBackoff.toMillis(), 1L) * attempt;
                log.debug("Mod {} is being written by another request (attempt {}/{}). Retrying in {}ms",
                    modId, attempt, maxAttempts, backoff);
                sleepUnchecked(backoff);
            }
        }
        log.info("Gave up waiting for write lease on mod {} after {} attempts", modId, maxAttempts);
        throw new ConcurrentModUpdateException(modId);
    }

    private boolean isExpired(String heldToken) {
        int separator = heldToken.indexOf('_');
        if (separator <= 0) {
            return true;
        }
        try {
            long acquiredAt = Long.parseLong(heldToken.substring(0, separator));
            return clock.millis() - acquiredAt >= leaseTimeout.toMillis();
        } catch (NumberFormatException e) {
            log.warn("Unreadable write lease token '{}'; treating it as expired", heldToken);
            return true;
        }
    }

    private static void sleepUnchecked(long durationMillis) {
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a mod write lease", interruptedException);
        }
    }

    /**
     * A held write lease. Closing it removes the entry only if it is still this lease's.
     */
    public final class Lease implements AutoCloseable {

        private final String modId;
        private final String token;

        private Lease(String modId, String token) {
            this.modId = modId;
            this.token = token;
        }

        @Override
        public void close() {
            try {
                if (!store.deleteIfValue(modId, token)) {
                    log.warn("Write lease on mod {} was taken over before it was released", modId);
                }
            } catch (DataAccessException e) {
                log.warn("Could not release write lease on mod {}; it lapses after {}", modId, leaseTimeout, e);
            }
        }
    }
}
