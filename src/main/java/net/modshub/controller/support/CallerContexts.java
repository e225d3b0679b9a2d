package net.modshub.controller.support;

import net.modshub.domain.CallerContext;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;

/**
 * Builds a {@link CallerContext} from the Spring Security authentication of a request.
 */
public final class CallerContexts {

    static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    private CallerContexts() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * @param authentication request authentication; null or anonymous tokens map to anonymous
     */
    public static CallerContext from(Authentication authentication) {
        if (authentication == null
                || authentication instanceof AnonymousAuthenticationToken
                || !authentication.isAuthenticated()
                || authentication.getName() == null) {
            return CallerContext.anonymous();
        }
        boolean admin = authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .anyMatch(ADMIN_AUTHORITY::equals);
        return admin ? CallerContext.admin(authentication.getName()) : CallerContext.user(authentication.getName());
    }
}
