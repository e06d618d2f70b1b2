package com.warden.security;

/**
 * A user identity token policy advertised by an endpoint.
 *
 * @param policyId          unique policy identifier
 * @param kind              the kind of credential the policy accepts
 * @param issuedTokenType   token profile URI for {@link CredentialKind#ISSUED} policies, otherwise null
 * @param issuerEndpointUrl for bearer token policies, the JSON blob parsed into {@link BearerTokenParameters}
 * @param securityPolicyUri security policy used to encrypt the token, null to use the channel's
 */
public record TokenPolicy(
        String policyId,
        CredentialKind kind,
        String issuedTokenType,
        String issuerEndpointUrl,
        String securityPolicyUri
) {

    public TokenPolicy {
        if (policyId == null || policyId.isBlank()) {
            throw new IllegalArgumentException("policyId must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }

    /** Creates a policy for a credential kind that carries no issuer data. */
    public static TokenPolicy of(String policyId, CredentialKind kind) {
        return new TokenPolicy(policyId, kind, null, null, null);
    }

    /** Creates an issued token policy. */
    public static TokenPolicy issued(String policyId, String issuedTokenType, String issuerEndpointUrl) {
        return new TokenPolicy(policyId, CredentialKind.ISSUED, issuedTokenType, issuerEndpointUrl, null);
    }

    /** True if this policy accepts JSON Web Token bearer credentials. */
    public boolean isBearerTokenPolicy() {
        return kind == CredentialKind.ISSUED && TokenProfiles.JWT_USER_TOKEN.equals(issuedTokenType);
    }

    /** Returns a copy with the given issuer endpoint URL. */
    public TokenPolicy withIssuerEndpointUrl(String url) {
        return new TokenPolicy(policyId, kind, issuedTokenType, url, securityPolicyUri);
    }
}
