package com.automate.ScanOps.Models;

import java.util.List;
import java.util.UUID;

/**
 * Principal built from a validated access token. Roles are stored without the ROLE_ prefix.
 */
public record AuthenticatedUser(UUID userId, String email, List<String> roles) {

    public static final String ADMIN = "ADMIN";
    public static final String ENGINEER = "ENGINEER";
    public static final String VIEWER = "VIEWER";

    public AuthenticatedUser {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean isAdmin() {
        return roles.contains(ADMIN);
    }

    /** owners see their own runs and scans, admins see everything */
    public boolean canView(UUID ownerId) {
        return isAdmin() || userId.equals(ownerId);
    }
}
