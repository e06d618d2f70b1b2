package com.warden.security;

/**
 * A token whose signature, issuer, audience and lifetime an external verifier has checked.
 */
public interface VerifiedToken {

    /** Human-readable name of the token's subject. */
    String displayName();
}
