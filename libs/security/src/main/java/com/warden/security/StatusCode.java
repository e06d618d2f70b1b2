package com.warden.security;

import java.util.Optional;

/**
 * Status codes surfaced to the host when a validation step fails.
 */
public enum StatusCode {

    GOOD(0x00000000L, "Good"),
    BAD_INTERNAL_ERROR(0x80020000L, "BadInternalError"),
    BAD_CERTIFICATE_INVALID(0x80120000L, "BadCertificateInvalid"),
    BAD_USER_ACCESS_DENIED(0x801F0000L, "BadUserAccessDenied"),
    BAD_IDENTITY_TOKEN_INVALID(0x80200000L, "BadIdentityTokenInvalid"),
    BAD_IDENTITY_TOKEN_REJECTED(0x80210000L, "BadIdentityTokenRejected"),
    BAD_CONFIGURATION_ERROR(0x80890000L, "BadConfigurationError"),
    BAD_SECURITY_MODE_INSUFFICIENT(0x80E60000L, "BadSecurityModeInsufficient");

    private final long code;
    private final String symbolicName;

    StatusCode(long code, String symbolicName) {
        this.code = code;
        this.symbolicName = symbolicName;
    }

    /** The 32-bit status code as an unsigned value. */
    public long code() {
        return code;
    }

    public String symbolicName() {
        return symbolicName;
    }

    public boolean isGood() {
        return (code & 0xC0000000L) == 0;
    }

    public static Optional<StatusCode> fromCode(long code) {
        for (StatusCode status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbolicName + String.format(" (0x%08X)", code);
    }
}
