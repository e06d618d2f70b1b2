package com.warden.security;

import java.security.cert.X509Certificate;

/**
 * An X.509 user certificate whose possession the client has already proven.
 */
public record CertificateCredential(X509Certificate certificate) implements UserCredential {

    public CertificateCredential {
        if (certificate == null) {
            throw new IllegalArgumentException("certificate must not be null");
        }
    }

    @Override
    public CredentialKind kind() {
        return CredentialKind.CERTIFICATE;
    }

    /** The certificate's subject distinguished name. */
    public String subject() {
        return certificate.getSubjectX500Principal().getName();
    }
}
