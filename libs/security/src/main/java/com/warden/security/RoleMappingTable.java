package com.warden.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Three independent case-insensitive tables mapping scope claims, user names and
 * role claims to roles.
 * <p>
 * Built once at startup through {@link Builder} and immutable afterwards, so lookups
 * need no synchronization.
 */
public final class RoleMappingTable {

    private final Map<String, Set<RoleId>> scopes;
    private final Map<String, Set<RoleId>> users;
    private final Map<String, Set<RoleId>> roles;

    private RoleMappingTable(Builder builder) {
        this.scopes = freeze(builder.scopes);
        this.users = freeze(builder.users);
        this.roles = freeze(builder.roles);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The mappings a stock authorization server starts with.
     */
    public static RoleMappingTable defaults() {
        return builder()
                .scope("UAServer", RoleId.OBSERVER)
                .user("gdsadmin", RoleId.SECURITY_ADMIN)
                .user("appadmin", RoleId.ENGINEER)
                .user("appuser", RoleId.OPERATOR)
                .role("admin", RoleId.SECURITY_ADMIN, RoleId.CONFIGURE_ADMIN)
                .role("superuser", RoleId.ENGINEER)
                .role("user", RoleId.OPERATOR)
                .build();
    }

    /** An empty table: every lookup misses. */
    public static RoleMappingTable empty() {
        return builder().build();
    }

    public Set<RoleId> rolesForScope(String scope) {
        return lookup(scopes, scope);
    }

    public Set<RoleId> rolesForUser(String userName) {
        return lookup(users, userName);
    }

    public Set<RoleId> rolesForRoleClaim(String roleClaim) {
        return lookup(roles, roleClaim);
    }

    public Map<String, Set<RoleId>> scopes() {
        return scopes;
    }

    public Map<String, Set<RoleId>> users() {
        return users;
    }

    public Map<String, Set<RoleId>> roles() {
        return roles;
    }

    static String fold(String key) {
        return key.strip().toLowerCase(Locale.ROOT);
    }

    private static Set<RoleId> lookup(Map<String, Set<RoleId>> table, String key) {
        if (key == null || key.isBlank()) {
            return Set.of();
        }
        return table.getOrDefault(fold(key), Set.of());
    }

    private static Map<String, Set<RoleId>> freeze(Map<String, Set<RoleId>> source) {
        Map<String, Set<RoleId>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(value))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Accumulates mappings. Repeated keys (after case folding) extend the existing role set.
     */
    public static final class Builder {

        private final Map<String, Set<RoleId>> scopes = new LinkedHashMap<>();
        private final Map<String, Set<RoleId>> users = new LinkedHashMap<>();
        private final Map<String, Set<RoleId>> roles = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder scope(String scope, RoleId... granted) {
            return scope(scope, List.of(granted));
        }

        public Builder scope(String scope, Collection<RoleId> granted) {
            put(scopes, scope, granted);
            return this;
        }

        public Builder user(String userName, RoleId... granted) {
            return user(userName, List.of(granted));
        }

        public Builder user(String userName, Collection<RoleId> granted) {
            put(users, userName, granted);
            return this;
        }

        public Builder role(String roleClaim, RoleId... granted) {
            return role(roleClaim, List.of(granted));
        }

        public Builder role(String roleClaim, Collection<RoleId> granted) {
            put(roles, roleClaim, granted);
            return this;
        }

        public RoleMappingTable build() {
            return new RoleMappingTable(this);
        }

        private static void put(Map<String, Set<RoleId>> table, String key, Collection<RoleId> granted) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("mapping key must not be null or blank");
            }
            if (granted == null || granted.isEmpty()) {
                throw new IllegalArgumentException("mapping for '" + key + "' must grant at least one role");
            }
            table.computeIfAbsent(fold(key), k -> new LinkedHashSet<>()).addAll(granted);
        }
    }
}
