package com.warden.security;

/**
 * A parsed per-request or per-session user identity token.
 * <p>
 * Closed over the four token kinds a policy can accept; {@link CredentialValidator}
 * has one handler per variant.
 */
public sealed interface UserCredential
        permits AnonymousCredential, UserNameCredential, CertificateCredential, IssuedTokenCredential {

    /** The kind of policy this credential is presented under. */
    CredentialKind kind();
}
