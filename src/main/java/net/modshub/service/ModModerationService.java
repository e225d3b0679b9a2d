package net.modshub.service;

import java.time.Clock;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.domain.ModStatus;
import net.modshub.exception.ConcurrentModUpdateException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.exception.ModNotFoundException;
import net.modshub.repository.ModRepository;
import org.springframework.stereotype.Service;

/**
 * Admin-only moderation: status changes and the featured flag. Neither touches slugs or
 * visibility, so no index is involved.
 *
 * <p>Each change is a version-checked replace of the latest record. A replace that loses
 * to a concurrent write is re-applied to the fresh record, up to {@value #MAX_ATTEMPTS} times.</p>
 */
@Slf4j
@Service
public class ModModerationService {

    static final int MAX_ATTEMPTS = 3;

    private final ModRepository modRepository;
    private final Clock clock;

    public ModModerationService(ModRepository modRepository, Clock clock) {
        this.modRepository = modRepository;
        this.clock = clock;
    }

    public Mod updateStatus(String modId, ModStatus status, String reason, CallerContext caller) {
        requireAdmin(modId, caller);
        Mod updated = revise(modId, current -> current.getStatus() == status
            ? current
            : current.nextRevision().status(status).updatedAt(clock.instant()).build());
        log.info("Mod {} status set to {} by {} (reason: {})",
            modId, status.wireValue(), caller.userId(),
            reason == null || reason.isBlank() ? "none given" : reason);
        return updated;
    }

    public Mod setFeatured(String modId, boolean featured, CallerContext caller) {
        requireAdmin(modId, caller);
        Mod updated = revise(modId, current -> current.isFeatured() == featured
            ? current
            : current.nextRevision().featured(featured).updatedAt(clock.instant()).build());
        log.info("Mod {} featured={} set by {}", modId, featured, caller.userId());
        return updated;
    }

    /**
     * Applies {@code change} to the latest record. Returning the same instance means
     * there is nothing to store.
     */
    private Mod revise(String modId, UnaryOperator<Mod> change) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Mod current = modRepository.findById(modId)
                .orElseThrow(() -> new ModNotFoundException(modId));
            Mod updated = change.apply(current);
            if (updated == current || modRepository.replace(current, updated)) {
                return updated;
            }
            log.debug("Mod {} changed during moderation (attempt {}/{}); re-reading", modId, attempt, MAX_ATTEMPTS);
        }
        throw new ConcurrentModUpdateException(modId);
    }

    private static void requireAdmin(String modId, CallerContext caller) {
        if (!caller.admin()) {
            throw new ModAccessDeniedException(modId, "moderate");
        }
    }
}
