package com.warden.security;

/**
 * Locates a certificate in a directory store by thumbprint or subject name.
 *
 * @param storePath   directory holding PEM or DER encoded certificates
 * @param subjectName subject distinguished name, or a bare common name (may be null)
 * @param thumbprint  hex SHA-1 thumbprint (may be null); takes precedence over the subject
 */
public record CertificateReference(String storePath, String subjectName, String thumbprint) {

    public CertificateReference {
        if (storePath == null || storePath.isBlank()) {
            throw new IllegalArgumentException("storePath must not be null or blank");
        }
    }

    /** Returns a copy with the given subject name. */
    public CertificateReference withSubjectName(String newSubjectName) {
        return new CertificateReference(storePath, newSubjectName, thumbprint);
    }

    @Override
    public String toString() {
        return thumbprint != null ? storePath + "[" + thumbprint + "]" : storePath + "[" + subjectName + "]";
    }
}
