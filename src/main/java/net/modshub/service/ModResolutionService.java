package net.modshub.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import net.modshub.config.ModsProperties;
import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModStatus;
import net.modshub.domain.ModVisibility;
import net.modshub.exception.ConcurrentModUpdateException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.exception.ModNotFoundException;
import net.modshub.exception.SlugConflictException;
import net.modshub.repository.ModRepository;
import net.modshub.service.index.PublicExposureIndex;
import net.modshub.service.index.SlugReservationIndex;
import net.modshub.service.index.SlugReservationIndex.ReservationResult;
import net.modshub.service.lock.ModWriteLock;
import net.modshub.util.IdentifierClassifier;
import net.modshub.util.ModIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Creates, updates, deletes and resolves mods while keeping the record store, the slug
 * reservation index and the public exposure index aligned.
 *
 * <p>This service is the only writer of both indices. Slug ownership is decided by one
 * conditional insert into the reservation index. Writes to an existing mod hold its
 * {@link ModWriteLock} lease and store the record with a version-checked replace. Index
 * entries are added before the record is written and removed after it, so an
 * interrupted operation leaves at worst a surplus or lagging entry, which
 * {@link #resolve} reports as not-found.</p>
 */
@Service
public class ModResolutionService {

    private static final Logger log = LoggerFactory.getLogger(ModResolutionService.class);

    // Width of the mods.mod_id column
    private static final int MAX_MOD_ID_LENGTH = 64;

    private final ModRepository modRepository;
    private final SlugReservationIndex reservationIndex;
    private final PublicExposureIndex exposureIndex;
    private final ModAccessPolicy accessPolicy;
    private final ModWriteLock writeLock;
    private final UploaderApprovalService uploaderApprovals;
    private final ModsProperties properties;
    private final Clock clock;

    private final Counter createConflicts;
    private final Counter updateConflicts;
    private final Counter staleReservationHits;
    private final Counter stalePublicHits;
    private final Counter exposureFailures;
    private final Counter concurrentUpdates;

    public ModResolutionService(ModRepository modRepository,
                                SlugReservationIndex reservationIndex,
                                PublicExposureIndex exposureIndex,
                                ModAccessPolicy accessPolicy,
                                ModWriteLock writeLock,
                                UploaderApprovalService uploaderApprovals,
                                ModsProperties properties,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.modRepository = modRepository;
        this.reservationIndex = reservationIndex;
        this.exposureIndex = exposureIndex;
        this.accessPolicy = accessPolicy;
        this.writeLock = writeLock;
        this.uploaderApprovals = uploaderApprovals;
        this.properties = properties;
        this.clock = clock;
        this.createConflicts = Counter.builder("mods.slug.conflicts")
            .tag("operation", "create")
            .register(meterRegistry);
        this.updateConflicts = Counter.builder("mods.slug.conflicts")
            .tag("operation", "update")
            .register(meterRegistry);
        this.staleReservationHits = Counter.builder("mods.index.stale_hits")
            .tag("index", reservationIndex.namespace())
            .register(meterRegistry);
        this.stalePublicHits = Counter.builder("mods.index.stale_hits")
            .tag("index", exposureIndex.namespace())
            .register(meterRegistry);
        this.exposureFailures = meterRegistry.counter("mods.index.exposure_failures");
        this.concurrentUpdates = meterRegistry.counter("mods.write.concurrent_updates");
    }

    /**
     * Creates a mod owned by the caller.
     *
     * @throws SlugConflictException when the title's slug belongs to another mod;
     *         nothing is written in that case
     * @throws ModAccessDeniedException when the caller is not an admin or approved uploader
     */
    public Mod createMod(ModDraft draft, CallerContext caller) {
        if (!caller.isAuthenticated()) {
            throw new ModAccessDeniedException("new mod", "create");
        }
        if (!uploaderApprovals.mayUpload(caller)) {
            throw ModAccessDeniedException.uploadNotApproved(caller.userId());
        }
        String title = ModInputNormalizer.requireTitle(draft.title());
        String slug = ModInputNormalizer.slugFor(title);
        String description = ModInputNormalizer.description(draft.description());
        Instant now = clock.instant();
        String modId = ModIdGenerator.generate(now.toEpochMilli());

        ReservationResult reservation = reservationIndex.reserve(slug, modId);
        if (reservation.isConflict()) {
            createConflicts.increment();
            log.info("Rejected create of '{}' by {}: slug {} held by {}",
                title, caller.userId(), slug, reservation.holderModId());
            throw new SlugConflictException(slug, reservation.holderModId());
        }

        Mod mod = Mod.builder()
            .modId(modId)
            .slug(slug)
            .title(title)
            .description(description)
            .category(draft.category() != null ? draft.category() : ModCategory.OTHER)
            .tags(ModInputNormalizer.tags(draft.tags()))
            .visibility(draft.visibility() != null ? draft.visibility() : ModVisibility.PUBLIC)
            .status(ModStatus.PENDING)
            .ownerId(caller.userId())
            .createdAt(now)
            .updatedAt(now)
            .build();
        modRepository.insert(mod);

        if (mod.isPublic()) {
            exposeAfterCreate(mod);
        }
        log.info("Created mod {} with slug {} ({}) for {}",
            modId, slug, mod.getVisibility().wireValue(), caller.userId());
        return mod;
    }

    /**
     * Applies a partial update. A title whose slug changes is all-or-nothing: on conflict
     * no field changes.
     *
     * @throws ConcurrentModUpdateException when another write to the same mod keeps the
     *         lease or lands first; nothing from this call is applied in that case
     */
    public Mod updateMod(String modId, ModChanges changes, CallerContext caller) {
        requireModIdFormat(modId);
        try (ModWriteLock.Lease lease = writeLock.acquire(modId)) {
            Mod current = modRepository.findById(modId)
                .orElseThrow(() -> new ModNotFoundException(modId));
            accessPolicy.requireVisible(caller, current, modId);
            accessPolicy.requireManageable(caller, current, "update");
            if (changes.isEmpty()) {
                return current;
            }
            return applyChanges(current, changes);
        }
    }

    private Mod applyChanges(Mod current, ModChanges changes) {
        String modId = current.getModId();
        String title = changes.title() != null
            ? ModInputNormalizer.requireTitle(changes.title())
            : current.getTitle();
        String slug = changes.title() != null ? ModInputNormalizer.slugFor(title) : current.getSlug();
        ModVisibility visibility = changes.visibility() != null ? changes.visibility() : current.getVisibility();
        String oldSlug = current.getSlug();
        boolean renamed = !slug.equals(oldSlug);

        Mod.ModBuilder updated = current.nextRevision()
            .title(title)
            .slug(slug)
            .visibility(visibility)
            .updatedAt(clock.instant());
        if (changes.description() != null) {
            updated.description(ModInputNormalizer.description(changes.description()));
        }
        if (changes.category() != null) {
            updated.category(changes.category());
        }
        if (changes.tags() != null) {
            updated.tags(ModInputNormalizer.tags(changes.tags()));
        }

        boolean reservedHere = false;
        if (renamed) {
            ReservationResult reservation = reservationIndex.reserve(slug, modId);
            if (reservation.isConflict()) {
                updateConflicts.increment();
                log.info("Rejected rename of {} from {} to {}: slug held by {}",
                    modId, oldSlug, slug, reservation.holderModId());
                throw new SlugConflictException(slug, reservation.holderModId());
            }
            reservedHere = reservation.outcome() == ReservationResult.Outcome.RESERVED;
        }
        boolean exposing = visibility == ModVisibility.PUBLIC && (renamed || !current.isPublic());
        Mod saved = updated.build();
        boolean exposedHere = false;
        boolean replaced;
        try {
            exposedHere = exposing && exposeReserved(slug, modId);
            replaced = modRepository.replace(current, saved);
        } catch (RuntimeException e) {
            // Replace outcome unknown: keep only what the stored record needs
            abandonAfterFailure(modId, slug, reservedHere, exposing, e);
            throw e;
        }
        if (!replaced) {
            abandonIndexChanges(modId, slug, reservedHere, exposedHere);
            concurrentUpdates.increment();
            log.warn("Mod {} changed while its update was in flight (expected version {}); update discarded",
                modId, current.getVersion());
            throw new ConcurrentModUpdateException(modId);
        }

        if (renamed) {
            exposureIndex.withdraw(oldSlug, modId);
            reservationIndex.release(oldSlug, modId);
            log.info("Renamed mod {} slug {} -> {}", modId, oldSlug, slug);
        } else if (current.isPublic() && visibility != ModVisibility.PUBLIC) {
            exposureIndex.withdraw(slug, modId);
        }
        if (visibility != current.getVisibility()) {
            log.info("Changed visibility of mod {} from {} to {}",
                modId, current.getVisibility().wireValue(), visibility.wireValue());
        }
        return saved;
    }

    /**
     * Deletes a mod: exposure first, then the reservation, then the record.
     */
    public void deleteMod(String modId, CallerContext caller) {
        requireModIdFormat(modId);
        try (ModWriteLock.Lease lease = writeLock.acquire(modId)) {
            Mod current = modRepository.findById(modId)
                .orElseThrow(() -> new ModNotFoundException(modId));
            accessPolicy.requireVisible(caller, current, modId);
            accessPolicy.requireManageable(caller, current, "delete");

            exposureIndex.withdraw(current.getSlug(), modId);
            reservationIndex.release(current.getSlug(), modId);
            if (!modRepository.deleteById(modId)) {
                throw new ModNotFoundException(modId);
            }
            log.info("Deleted mod {} (slug {}) by {}", modId, current.getSlug(), caller.userId());
        }
    }

    /**
     * Resolves a mod id or an exact slug for the caller. Anonymous callers only see
     * slugs of public mods; authenticated callers search every reservation.
     *
     * @throws ModNotFoundException when nothing matches, the index is out of date,
     *         or an anonymous caller may not see the mod
     * @throws ModAccessDeniedException when an authenticated caller may not see the mod
     */
    public Mod resolve(String identifierOrSlug, CallerContext caller) {
        Mod mod = switch (IdentifierClassifier.classify(identifierOrSlug)) {
            case MOD_ID -> modRepository.findById(identifierOrSlug)
                .orElseThrow(() -> new ModNotFoundException(identifierOrSlug));
            case SLUG -> resolveSlug(identifierOrSlug, caller);
            case UNKNOWN -> throw new ModNotFoundException(String.valueOf(identifierOrSlug));
        };
        accessPolicy.requireVisible(caller, mod, identifierOrSlug);
        return mod;
    }

    private Mod resolveSlug(String slug, CallerContext caller) {
        boolean anonymous = !caller.isAuthenticated();
        Optional<String> indexed = anonymous ? exposureIndex.lookup(slug) : reservationIndex.lookup(slug);
        String modId = indexed.orElseThrow(() -> new ModNotFoundException(slug));

        Optional<Mod> record = modRepository.findById(modId);
        if (record.isEmpty()) {
            onStaleIndexHit(slug, modId, anonymous ? stalePublicHits : staleReservationHits,
                anonymous ? exposureIndex.namespace() : reservationIndex.namespace());
            throw new ModNotFoundException(slug);
        }
        Mod mod = record.get();
        // Entry not yet cleaned up after a rename
        if (!slug.equals(mod.getSlug())) {
            log.debug("Slug {} still indexed for mod {} whose slug is now {}", slug, modId, mod.getSlug());
            throw new ModNotFoundException(slug);
        }
        return mod;
    }

    private void onStaleIndexHit(String slug, String modId, Counter counter, String indexName) {
        counter.increment();
        log.warn("Index {} maps slug {} to missing mod {}", indexName, slug, modId);

        ModsProperties.Resolution resolution = properties.getResolution();
        if (!resolution.isSelfHeal()) {
            return;
        }
        OptionalLong mintedAt = ModIdGenerator.extractEpochMillis(modId);
        if (mintedAt.isEmpty()
                || clock.millis() - mintedAt.getAsLong() < resolution.getStaleIndexGrace().toMillis()) {
            log.debug("Leaving stale entry {} -> {} alone; the mod may still be being created", slug, modId);
            return;
        }
        try {
            boolean exposureRemoved = exposureIndex.withdraw(slug, modId);
            boolean reservationRemoved = reservationIndex.release(slug, modId);
            log.info("Healed stale slug {} -> {} (exposure removed: {}, reservation removed: {})",
                slug, modId, exposureRemoved, reservationRemoved);
        } catch (DataAccessException e) {
            log.warn("Could not heal stale slug {} -> {}; will retry on a later lookup", slug, modId, e);
        }
    }

    private static void requireModIdFormat(String modId) {
        if (!ModIdGenerator.isModId(modId) || modId.length() > MAX_MOD_ID_LENGTH) {
            throw new ModNotFoundException(String.valueOf(modId));
        }
    }

    private void exposeAfterCreate(Mod mod) {
        try {
            if (exposeReserved(mod.getSlug(), mod.getModId())) {
                return;
            }
            exposureFailures.increment();
            log.error("Mod {} created but slug {} could not be exposed publicly", mod.getModId(), mod.getSlug());
        } catch (DataAccessException e) {
            exposureFailures.increment();
            log.error("Mod {} created but slug {} was not exposed publicly; anonymous slug lookups "
                + "will miss until it is renamed or made public again", mod.getModId(), mod.getSlug(), e);
        }
    }

    /**
     * Exposes {@code slug} for {@code modId} only while the reservation maps it to
     * {@code modId}. An exposure held by another mod id then belongs to a mod that no longer
     * owns the slug and is withdrawn first.
     *
     * @return whether the slug is exposed for {@code modId}
     */
    private boolean exposeReserved(String slug, String modId) {
        for (int round = 1; round <= 2; round++) {
            if (!reservationIndex.isHeldBy(slug, modId)) {
                log.warn("Not exposing slug {} for mod {}: the reservation is not held by it", slug, modId);
                return false;
            }
            Optional<String> blocking = exposureIndex.expose(slug, modId);
            if (blocking.isEmpty()) {
                return true;
            }
            log.warn("Withdrawing leftover exposure of slug {} by mod {} in favour of {}", slug, blocking.get(), modId);
            exposureIndex.withdraw(slug, blocking.get());
        }
        return false;
    }

    private void abandonAfterFailure(String modId, String slug, boolean reservedHere, boolean exposing,
                                     RuntimeException failure) {
        try {
            abandonIndexChanges(modId, slug, reservedHere, exposing);
        } catch (DataAccessException e) {
            failure.addSuppressed(e);
            log.warn("Could not undo index entries for slug {} of mod {} after a failed update", slug, modId, e);
        }
    }

    /**
     * Undoes the index entries an update added before its record replace lost the race,
     * keeping whatever the stored record still needs.
     */
    private void abandonIndexChanges(String modId, String slug, boolean reservedHere, boolean exposedHere) {
        Optional<Mod> latest = modRepository.findById(modId);
        boolean slugInUse = latest.filter(mod -> slug.equals(mod.getSlug())).isPresent();
        boolean exposureInUse = slugInUse && latest.get().isPublic();
        if (exposedHere && !exposureInUse) {
            exposureIndex.withdraw(slug, modId);
        }
        if (reservedHere && !slugInUse) {
            reservationIndex.release(slug, modId);
        }
    }
}
