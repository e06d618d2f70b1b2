package com.warden.security;

/**
 * The identity a credential asserts, before roles are attached.
 *
 * @param displayName     human-readable name of the user
 * @param kind            the kind of credential that produced the identity
 * @param issuedTokenType token profile URI for issued credentials, otherwise null
 */
public record BaseIdentity(String displayName, CredentialKind kind, String issuedTokenType) {

    public BaseIdentity {
        if (displayName == null) {
            throw new IllegalArgumentException("displayName must not be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }

    public static BaseIdentity of(String displayName, CredentialKind kind) {
        return new BaseIdentity(displayName, kind, null);
    }
}
