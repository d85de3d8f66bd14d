package com.studioledger.backup.security;

import java.util.UUID;

/**
 * Principal built from a verified bearer token.
 */
public record AuthenticatedUser(UUID id, String email, String role) {

    public boolean isAdmin() {
        return "admin".equalsIgnoreCase(role);
    }
}
