package com.warden.security;

/**
 * Kinds of user identity token a policy can accept.
 */
public enum CredentialKind {
    ANONYMOUS,
    USER_NAME,
    CERTIFICATE,
    ISSUED
}
