package net.modshub.domain;

import java.util.Objects;

/**
 * Identity of whoever is asking. An anonymous caller has no user id and is never admin.
 *
 * @param userId authenticated username, or null when anonymous
 * @param admin whether the caller holds the admin capability
 */
public record CallerContext(String userId, boolean admin) {

    private static final CallerContext ANONYMOUS = new CallerContext(null, false);

    public CallerContext {
        if (userId == null && admin) {
            throw new IllegalArgumentException("An anonymous caller cannot be admin");
        }
    }

    public static CallerContext anonymous() {
        return ANONYMOUS;
    }

    public static CallerContext user(String userId) {
        return new CallerContext(Objects.requireNonNull(userId, "userId"), false);
    }

    public static CallerContext admin(String userId) {
        return new CallerContext(Objects.requireNonNull(userId, "userId"), true);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public boolean owns(Mod mod) {
        return userId != null && userId.equals(mod.getOwnerId());
    }
}
