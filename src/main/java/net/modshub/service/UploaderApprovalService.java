package net.modshub.service;

import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import net.modshub.config.ModsProperties;
import net.modshub.domain.CallerContext;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.repository.KeyValueStore;
import org.springframework.util.StringUtils;

/**
 * Admin-managed list of users allowed to upload mods, stored as {@code userId -> approvedBy}.
 * Admins may always upload. With {@code app.mods.uploads.require-approval=false} everyone may.
 */
@Slf4j
public class UploaderApprovalService {

    static final int MAX_USER_ID_LENGTH = 128;

    private final KeyValueStore store;
    private final ModsProperties properties;

    public UploaderApprovalService(KeyValueStore store, ModsProperties properties) {
        this.store = Objects.requireNonNull(store, "store");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public boolean mayUpload(CallerContext caller) {
        if (!caller.isAuthenticated()) {
            return false;
        }
        if (caller.admin() || !properties.getUploads().isRequireApproval()) {
            return true;
        }
        return store.get(caller.userId()).isPresent();
    }

    public List<String> listApproved(CallerContext caller) {
        requireAdmin(caller, "list");
        return store.keys();
    }

    /**
     * Approves {@code userId}; approving twice records the latest approver.
     */
    public void approve(String userId, CallerContext caller) {
        requireAdmin(caller, "approve");
        String normalized = normalizeUserId(userId);
        store.put(normalized, caller.userId());
        log.info("Uploader {} approved by {}", normalized, caller.userId());
    }

    /**
     * @return whether the user was approved before this call
     */
    public boolean revoke(String userId, CallerContext caller) {
        requireAdmin(caller, "revoke");
        String normalized = normalizeUserId(userId);
        boolean removed = store.delete(normalized);
        log.info("Uploader {} revoked by {} (was approved: {})", normalized, caller.userId(), removed);
        return removed;
    }

    private static void requireAdmin(CallerContext caller, String action) {
        if (!caller.admin()) {
            throw ModAccessDeniedException.adminOnly(action + " uploader approvals");
        }
    }

    private static String normalizeUserId(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new InvalidModRequestException("userId is required");
        }
        String trimmed = userId.trim();
        if (trimmed.length() > MAX_USER_ID_LENGTH) {
            throw new InvalidModRequestException("userId must be at most " + MAX_USER_ID_LENGTH + " characters");
        }
        return trimmed;
    }
}
