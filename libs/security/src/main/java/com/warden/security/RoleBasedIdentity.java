package com.warden.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A validated identity together with the roles granted to it.
 * <p>
 * Immutable. Role order is the order in which roles were granted; duplicates are dropped.
 * Handed to the host session layer, which owns it for the life of the session or request.
 *
 * @param identity the underlying identity
 * @param roles    granted roles, never empty
 */
public record RoleBasedIdentity(BaseIdentity identity, Set<RoleId> roles) {

    public RoleBasedIdentity {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("roles must contain at least one role");
        }
        roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
    }

    public static RoleBasedIdentity of(BaseIdentity identity, Collection<RoleId> roles) {
        return new RoleBasedIdentity(identity, roles == null ? null : new LinkedHashSet<>(roles));
    }

    public String displayName() {
        return identity.displayName();
    }

    public CredentialKind kind() {
        return identity.kind();
    }

    public boolean isAnonymous() {
        return identity.kind() == CredentialKind.ANONYMOUS;
    }

    public boolean hasRole(RoleId role) {
        return roles.contains(role);
    }
}
