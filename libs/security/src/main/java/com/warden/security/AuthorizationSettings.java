package com.warden.security;

import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The effective authorization configuration after startup processing.
 *
 * @param policies            policies that passed initialization, with issuer data filled in
 * @param validators          validator entries with host names and issuer URIs resolved
 * @param trustedCertificates union of the trust lists of all certificate policies
 * @param skippedPolicies     policies dropped because their configuration was incomplete, with the reason
 */
public record AuthorizationSettings(
        List<TokenPolicy> policies,
        List<ValidatorConfig> validators,
        List<X509Certificate> trustedCertificates,
        Map<String, ServiceError> skippedPolicies
) {

    public AuthorizationSettings {
        policies = List.copyOf(policies);
        validators = List.copyOf(validators);
        trustedCertificates = List.copyOf(trustedCertificates);
        skippedPolicies = Collections.unmodifiableMap(new LinkedHashMap<>(skippedPolicies));
    }

    public Optional<TokenPolicy> policy(String policyId) {
        return policies.stream().filter(p -> p.policyId().equals(policyId)).findFirst();
    }

    /**
     * The active policy with the given id. A skipped policy fails with the error recorded
     * when it was skipped; an unknown one is rejected.
     */
    public ValidationResult<TokenPolicy> resolvePolicy(String policyId) {
        ServiceError skipReason = skippedPolicies.get(policyId);
        if (skipReason != null) {
            return ValidationResult.fail(skipReason);
        }
        return policy(policyId)
                .map(ValidationResult::ok)
                .orElseGet(() -> ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                        StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "IdentityTokenRejected")));
    }

    public Set<String> skippedPolicyIds() {
        return skippedPolicies.keySet();
    }

    public boolean isSkipped(String policyId) {
        return skippedPolicies.containsKey(policyId);
    }
}
