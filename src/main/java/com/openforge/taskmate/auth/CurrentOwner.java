package com.openforge.taskmate.auth;

import com.openforge.taskmate.error.AuthenticationRequiredException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/** Reads the authenticated owner id placed by {@link JwtAuthFilter}. */
public final class CurrentOwner {

    private CurrentOwner() {}

    public static Long require() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof Long ownerId)) {
            throw new AuthenticationRequiredException("Missing or invalid token");
        }
        return ownerId;
    }
}
