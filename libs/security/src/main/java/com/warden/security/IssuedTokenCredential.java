package com.warden.security;

import java.nio.charset.StandardCharsets;

/**
 * A token issued by an external authority, already decrypted by the transport layer.
 *
 * @param issuedTokenType token profile URI (see {@link TokenProfiles})
 * @param tokenData       the decrypted token bytes
 */
public record IssuedTokenCredential(String issuedTokenType, byte[] tokenData) implements UserCredential {

    public IssuedTokenCredential {
        if (tokenData == null) {
            throw new IllegalArgumentException("tokenData must not be null");
        }
    }

    /** Creates a bearer token credential from its string form. */
    public static IssuedTokenCredential bearer(String token) {
        return new IssuedTokenCredential(TokenProfiles.JWT_USER_TOKEN, token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public CredentialKind kind() {
        return CredentialKind.ISSUED;
    }

    /** The token data decoded as UTF-8. */
    public String tokenText() {
        return new String(tokenData, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "IssuedTokenCredential[issuedTokenType=" + issuedTokenType + ", length=" + tokenData.length + "]";
    }
}
