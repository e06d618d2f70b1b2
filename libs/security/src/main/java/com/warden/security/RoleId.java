package com.warden.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Well-known role identifiers granted to validated identities.
 * <p>
 * Each role carries the numeric node id under which the server's address space
 * publishes it and the browse name used in configuration files.
 */
public enum RoleId {

    ANONYMOUS(15644, "Anonymous"),
    AUTHENTICATED_USER(15656, "AuthenticatedUser"),
    OBSERVER(15668, "Observer"),
    OPERATOR(15680, "Operator"),
    ENGINEER(16036, "Engineer"),
    SUPERVISOR(15692, "Supervisor"),
    CONFIGURE_ADMIN(15716, "ConfigureAdmin"),
    SECURITY_ADMIN(15704, "SecurityAdmin");

    private final int nodeId;
    private final String browseName;

    RoleId(int nodeId, String browseName) {
        this.nodeId = nodeId;
        this.browseName = browseName;
    }

    /** Numeric identifier of the role object in namespace 0. */
    public int nodeId() {
        return nodeId;
    }

    /** The browse name (e.g., "SecurityAdmin"). */
    public String browseName() {
        return browseName;
    }

    /**
     * Looks up a role by browse name or enum constant name, ignoring case.
     *
     * @param value the string to match (e.g., "securityadmin", "SECURITY_ADMIN")
     * @return the matching role, or empty if not found
     */
    public static Optional<RoleId> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip();
        for (RoleId role : values()) {
            if (role.browseName.equalsIgnoreCase(normalized)
                    || role.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
