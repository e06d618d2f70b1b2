package com.warden.security;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A verified JSON Web Token and its claims.
 *
 * @param subject     the {@code sub} claim
 * @param displayName name to show for the subject
 * @param claims      all claims as decoded JSON values
 */
public record ClaimsToken(String subject, String displayName, Map<String, Object> claims) implements VerifiedToken {

    /** Claim holding the space-separated scope list. */
    public static final String SCOPE_CLAIM = "scp";

    public ClaimsToken {
        claims = claims == null ? Map.of() : Map.copyOf(claims);
        if (displayName == null) {
            displayName = subject != null ? subject : "";
        }
    }

    /**
     * Returns a claim rendered as a string. Array claims are joined with single spaces.
     */
    public Optional<String> claim(String name) {
        Object value = claims.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Collection<?> values) {
            return Optional.of(values.stream().map(String::valueOf).collect(Collectors.joining(" ")));
        }
        return Optional.of(value.toString());
    }
}
