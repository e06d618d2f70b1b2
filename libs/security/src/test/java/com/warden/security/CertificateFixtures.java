package com.warden.security;

import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

/**
 * Certificates under {@code src/test/resources/certs}: a test CA in {@code trusted/}, a user
 * certificate "appuser" issued by it, a self-signed "rogue" certificate in {@code untrusted/},
 * and a self-signed token authority "localhost" in {@code authority/}.
 */
final class CertificateFixtures {

    static final String AUTHORITY_THUMBPRINT = "64:E7:16:54:C0:DF:93:7D:1F:BA:09:DA:B1:D9:B0:AB:24:D0:24:74";
    static final String AUTHORITY_APPLICATION_URI = "urn:localhost:warden:authority";

    private CertificateFixtures() {
    }

    static Path path(String resource) {
        try {
            return Path.of(CertificateFixtures.class.getResource("/certs/" + resource).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static String directory(String resource) {
        return path(resource).toString();
    }

    static X509Certificate load(String resource) {
        try (InputStream in = CertificateFixtures.class.getResourceAsStream("/certs/" + resource)) {
            return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
        } catch (Exception e) {
            throw new IllegalStateException("cannot load " + resource, e);
        }
    }

    static X509Certificate user() {
        return load("user.pem");
    }

    static X509Certificate ca() {
        return load("trusted/ca.pem");
    }

    static X509Certificate rogue() {
        return load("untrusted/rogue.pem");
    }

    static X509Certificate authority() {
        return load("authority/authority.pem");
    }
}
