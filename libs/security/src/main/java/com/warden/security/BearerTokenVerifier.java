package com.warden.security;

import java.net.URI;
import java.security.cert.X509Certificate;

/**
 * Verifies bearer tokens against the authority that issued them.
 * <p>
 * Implementations check the signature against the authority's signing keys, and the
 * issuer, audience and lifetime claims. Calls may block on network I/O; there is no
 * internal timeout.
 */
public interface BearerTokenVerifier {

    /**
     * @param authorityUrl         base URL of the token authority
     * @param authorityCertificate signing certificate of the authority, null to discover it
     * @param issuerUri            expected issuer, null to accept the authority's default
     * @param audienceUri          this server's application URI
     * @param token                the encoded token
     * @return the verified token
     * @throws TokenVerificationException if the token is not valid
     */
    VerifiedToken verify(
            URI authorityUrl,
            X509Certificate authorityCertificate,
            String issuerUri,
            String audienceUri,
            String token) throws TokenVerificationException;
}
