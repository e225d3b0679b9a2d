package net.modshub.service;

import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.exception.ModNotFoundException;
import org.springframework.stereotype.Component;

/**
 * Visibility and ownership rules shared by resolution, listing and writes.
 *
 * <p>Anonymous callers never learn that a hidden mod exists: every denial they hit
 * is reported as not-found.</p>
 */
@Component
public class ModAccessPolicy {

    public boolean canView(CallerContext caller, Mod mod) {
        return mod.isPublic() || canManage(caller, mod);
    }

    public boolean canManage(CallerContext caller, Mod mod) {
        return caller.admin() || caller.owns(mod);
    }

    public void requireVisible(CallerContext caller, Mod mod, String requestedIdentifier) {
        if (canView(caller, mod)) {
            return;
        }
        throw denial(caller, mod, requestedIdentifier, "view");
    }

    public void requireManageable(CallerContext caller, Mod mod, String action) {
        if (canManage(caller, mod)) {
            return;
        }
        throw denial(caller, mod, mod.getModId(), action);
    }

    private RuntimeException denial(CallerContext caller, Mod mod, String requestedIdentifier, String action) {
        if (!caller.isAuthenticated()) {
            return new ModNotFoundException(requestedIdentifier);
        }
        return new ModAccessDeniedException(mod.getModId(), action);
    }
}
