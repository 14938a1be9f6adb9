package fr.lapetina.taskflow.auth;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Identity established by the authentication layer for the current request.
 */
public record AuthenticatedUser(String id, String email, String role) {

    private static final Set<String> ADMIN_ROLES = Set.of("admin", "super_admin");

    public AuthenticatedUser {
        Objects.requireNonNull(id, "User id is required");
    }

    public boolean isAdmin() {
        return role != null && ADMIN_ROLES.contains(role.toLowerCase(Locale.ROOT));
    }
}
