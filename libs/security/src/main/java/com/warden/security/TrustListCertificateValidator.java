package com.warden.security;

import java.security.InvalidAlgorithmParameterException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Trusts user certificates that are either listed directly in the trust list or chain up
 * to an issuer in it.
 * <p>
 * Chains are checked with the JDK's PKIX validator. Revocation checking is off: trust
 * lists are maintained by the administrator, who removes revoked entries.
 */
public final class TrustListCertificateValidator implements CertificateTrustValidator {

    private final Set<X509Certificate> trusted;
    private final Set<TrustAnchor> anchors;

    public TrustListCertificateValidator(Collection<X509Certificate> trustedCertificates) {
        if (trustedCertificates == null) {
            throw new IllegalArgumentException("trustedCertificates must not be null");
        }
        this.trusted = Set.copyOf(new LinkedHashSet<>(trustedCertificates));
        this.anchors = trusted.stream()
                .map(certificate -> new TrustAnchor(certificate, null))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void validate(X509Certificate certificate) throws CertificateException {
        certificate.checkValidity();
        if (trusted.contains(certificate)) {
            return;
        }
        if (anchors.isEmpty()) {
            throw new CertificateException("trust list is empty");
        }
        try {
            CertPath path = CertificateFactory.getInstance("X.509").generateCertPath(List.of(certificate));
            PKIXParameters parameters = new PKIXParameters(anchors);
            parameters.setRevocationEnabled(false);
            CertPathValidator.getInstance("PKIX").validate(path, parameters);
        } catch (CertPathValidatorException e) {
            throw new CertificateException("certificate does not chain to a trusted issuer: " + e.getMessage(), e);
        } catch (InvalidAlgorithmParameterException | NoSuchAlgorithmException e) {
            throw new CertificateException("cannot validate certificate path", e);
        }
    }

    public int size() {
        return trusted.size();
    }
}
