package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.Certificate;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads X.509 certificates from directory stores.
 * <p>
 * Every regular file in a store directory is parsed as one or more PEM or DER encoded
 * certificates; files that do not parse are logged and skipped. A directory is read once
 * and cached for the life of the store.
 */
public final class CertificateStore {

    private static final Logger log = LoggerFactory.getLogger(CertificateStore.class);

    /** Subject alternative name type of a uniform resource identifier. */
    private static final int SAN_URI = 6;

    private final Map<Path, List<X509Certificate>> directories = new ConcurrentHashMap<>();

    /**
     * Returns all certificates in the store directory; an absent directory yields an empty list.
     */
    public List<X509Certificate> certificates(String storePath) {
        Path directory = Path.of(storePath).toAbsolutePath().normalize();
        return directories.computeIfAbsent(directory, CertificateStore::readDirectory);
    }

    /**
     * Finds the certificate a reference points to: by thumbprint when one is given,
     * otherwise by subject name.
     */
    public Optional<X509Certificate> find(CertificateReference reference) {
        if (reference == null) {
            return Optional.empty();
        }
        for (X509Certificate certificate : certificates(reference.storePath())) {
            if (matches(reference, certificate)) {
                return Optional.of(certificate);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first URI subject alternative name, which by convention is the
     * application URI of the certificate's owner.
     */
    public static Optional<String> applicationUri(X509Certificate certificate) {
        Collection<List<?>> names;
        try {
            names = certificate.getSubjectAlternativeNames();
        } catch (CertificateParsingException e) {
            log.warn("Unreadable subject alternative names in '{}'", certificate.getSubjectX500Principal(), e);
            return Optional.empty();
        }
        if (names == null) {
            return Optional.empty();
        }
        for (List<?> name : names) {
            if (name.size() >= 2 && Integer.valueOf(SAN_URI).equals(name.get(0))) {
                return Optional.of(String.valueOf(name.get(1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Hex SHA-1 thumbprint of the certificate's DER encoding, upper case.
     */
    public static String thumbprint(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(certificate.getEncoded());
            return HexFormat.of().withUpperCase().formatHex(digest);
        } catch (NoSuchAlgorithmException | CertificateEncodingException e) {
            throw new IllegalStateException("cannot compute thumbprint", e);
        }
    }

    /**
     * Returns the common name of the certificate's subject, if present.
     */
    public static Optional<String> commonName(X509Certificate certificate) {
        return commonName(certificate.getSubjectX500Principal().getName());
    }

    static boolean matches(CertificateReference reference, X509Certificate certificate) {
        if (reference.thumbprint() != null && !reference.thumbprint().isBlank()) {
            String expected = reference.thumbprint().replace(":", "").strip();
            return expected.equalsIgnoreCase(thumbprint(certificate));
        }
        String subject = reference.subjectName();
        if (subject == null || subject.isBlank()) {
            return false;
        }
        if (subject.contains("=")) {
            try {
                return new X500Principal(subject).equals(certificate.getSubjectX500Principal());
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
        return commonName(certificate).map(cn -> cn.equalsIgnoreCase(subject.strip())).orElse(false);
    }

    private static Optional<String> commonName(String distinguishedName) {
        try {
            for (Rdn rdn : new LdapName(distinguishedName).getRdns()) {
                if ("CN".equalsIgnoreCase(rdn.getType())) {
                    return Optional.of(String.valueOf(rdn.getValue()));
                }
            }
        } catch (InvalidNameException e) {
            log.debug("Subject '{}' is not a distinguished name", distinguishedName);
        }
        return Optional.empty();
    }

    private static List<X509Certificate> readDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Certificate store '{}' does not exist", directory);
            return List.of();
        }
        List<X509Certificate> result = new ArrayList<>();
        CertificateFactory factory;
        try {
            factory = CertificateFactory.getInstance("X.509");
        } catch (CertificateException e) {
            throw new IllegalStateException("X.509 certificate factory unavailable", e);
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, Files::isRegularFile)) {
            for (Path file : files) {
                try (InputStream in = Files.newInputStream(file)) {
                    for (Certificate certificate : factory.generateCertificates(in)) {
                        if (certificate instanceof X509Certificate x509) {
                            result.add(x509);
                        }
                    }
                } catch (IOException | CertificateException e) {
                    log.warn("Skipping unreadable certificate file '{}': {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Cannot list certificate store '{}'", directory, e);
            return List.of();
        }
        log.debug("Loaded {} certificate(s) from '{}'", result.size(), directory);
        return List.copyOf(result);
    }
}
