package com.warden.security;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

/**
 * Decides whether a user certificate is trusted.
 */
@FunctionalInterface
public interface CertificateTrustValidator {

    /**
     * @throws CertificateException if the certificate is expired, malformed or not trusted
     */
    void validate(X509Certificate certificate) throws CertificateException;
}
