package com.warden.security;

/**
 * An anonymous identity token.
 */
public record AnonymousCredential() implements UserCredential {

    @Override
    public CredentialKind kind() {
        return CredentialKind.ANONYMOUS;
    }
}
