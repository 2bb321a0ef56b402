package com.agile.Buro.Filter;

import com.agile.Buro.entity.UserRole;

import java.security.Principal;
import java.util.UUID;

/**
 * Principal placed in the security context once a bearer token has been verified.
 */
public record AuthenticatedUser(UUID userId, String email, UserRole role) implements Principal {

    @Override
    public String getName() {
        return email;
    }
}
