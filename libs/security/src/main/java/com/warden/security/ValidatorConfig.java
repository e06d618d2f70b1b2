package com.warden.security;

/**
 * Verification settings for one issued token policy.
 *
 * @param policyId             the {@link TokenPolicy#policyId()} this entry applies to
 * @param authorityCertificate certificate of the token authority (may be null: verifier defaults apply)
 * @param issuerUri            expected token issuer (may be null: verifier defaults apply)
 * @param issuerEndpointUrl    bearer token parameters JSON copied onto the policy at startup (may be null)
 */
public record ValidatorConfig(
        String policyId,
        CertificateReference authorityCertificate,
        String issuerUri,
        String issuerEndpointUrl
) {

    public ValidatorConfig {
        if (policyId == null || policyId.isBlank()) {
            throw new IllegalArgumentException("policyId must not be null or blank");
        }
    }

    public ValidatorConfig withIssuerUri(String newIssuerUri) {
        return new ValidatorConfig(policyId, authorityCertificate, newIssuerUri, issuerEndpointUrl);
    }

    public ValidatorConfig withAuthorityCertificate(CertificateReference reference) {
        return new ValidatorConfig(policyId, reference, issuerUri, issuerEndpointUrl);
    }
}
