package com.warden.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves scope claims, user names and role claims to roles through a {@link RoleMappingTable}.
 * <p>
 * Unknown keys contribute nothing. Results keep the order in which roles were first seen.
 */
public final class RoleMapper {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RoleMappingTable table;

    public RoleMapper(RoleMappingTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table must not be null");
        }
        this.table = table;
    }

    /**
     * Maps a whitespace-separated scope list (the value of an {@code scp} claim) to roles.
     *
     * @param scopeString e.g. "UAServer openid"; null or blank yields no roles
     */
    public Set<RoleId> mapScopesToRoles(String scopeString) {
        Set<RoleId> result = new LinkedHashSet<>();
        if (scopeString == null || scopeString.isBlank()) {
            return result;
        }
        for (String scope : WHITESPACE.split(scopeString.strip())) {
            result.addAll(table.rolesForScope(scope));
        }
        return result;
    }

    /** Maps a user name to the roles configured for it. */
    public Set<RoleId> mapUserToRoles(String userName) {
        return new LinkedHashSet<>(table.rolesForUser(userName));
    }

    /** Maps role claims (e.g., directory group names) to roles. */
    public Set<RoleId> mapRoleClaimsToRoles(Collection<String> roleClaims) {
        Set<RoleId> result = new LinkedHashSet<>();
        if (roleClaims == null) {
            return result;
        }
        for (String claim : roleClaims) {
            result.addAll(table.rolesForRoleClaim(claim));
        }
        return result;
    }

    public RoleMappingTable table() {
        return table;
    }
}
