package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Prepares token policies and validator entries before the server accepts traffic.
 * <p>
 * For each validator entry: "localhost" in the authority certificate subject and issuer URI
 * is replaced by this host's name; a missing issuer URI is taken from the authority
 * certificate's application URI; the entry's issuer endpoint URL is copied onto the policy
 * with the same id.
 * <p>
 * A policy whose configuration is incomplete is logged and skipped; the remaining
 * policies stay usable. Incomplete means: a certificate policy without a readable, non-empty
 * trust list, or a bearer token policy without a validator entry or with unparseable
 * endpoint parameters.
 */
public final class TokenPolicyInitializer {

    private static final Logger log = LoggerFactory.getLogger(TokenPolicyInitializer.class);

    private static final String LOCALHOST = "localhost";

    private final CertificateStore certificateStore;
    private final String hostName;

    /**
     * @param certificateStore store used to resolve authority certificates and trust lists
     * @param hostName         name substituted for "localhost"; lower-cased
     */
    public TokenPolicyInitializer(CertificateStore certificateStore, String hostName) {
        if (certificateStore == null) {
            throw new IllegalArgumentException("certificateStore must not be null");
        }
        if (hostName == null || hostName.isBlank()) {
            throw new IllegalArgumentException("hostName must not be null or blank");
        }
        this.certificateStore = certificateStore;
        this.hostName = hostName.toLowerCase(Locale.ROOT);
    }

    /**
     * @param policies   the configured token policies
     * @param validators the configured validator entries
     * @param trustLists certificate store directory per certificate policy id
     */
    public AuthorizationSettings initialize(
            Collection<TokenPolicy> policies,
            Collection<ValidatorConfig> validators,
            Map<String, String> trustLists) {

        Map<String, TokenPolicy> effective = new LinkedHashMap<>();
        for (TokenPolicy policy : policies) {
            effective.put(policy.policyId(), policy);
        }

        Map<String, ValidatorConfig> resolved = new LinkedHashMap<>();
        for (ValidatorConfig validator : validators) {
            TokenPolicy policy = effective.get(validator.policyId());
            if (policy == null) {
                log.error("Validator entry names unknown policy '{}', ignored", validator.policyId());
                continue;
            }
            ValidatorConfig config = resolve(validator);
            resolved.put(config.policyId(), config);
            if (config.issuerEndpointUrl() != null) {
                effective.put(policy.policyId(), policy.withIssuerEndpointUrl(config.issuerEndpointUrl()));
            }
        }

        List<TokenPolicy> accepted = new ArrayList<>();
        Set<X509Certificate> trusted = new LinkedHashSet<>();
        Map<String, ServiceError> skipped = new LinkedHashMap<>();
        for (TokenPolicy policy : effective.values()) {
            Optional<ServiceError> problem = switch (policy.kind()) {
                case CERTIFICATE -> loadTrustList(policy, trustLists, trusted);
                case ISSUED -> checkIssued(policy, resolved);
                default -> Optional.empty();
            };
            if (problem.isPresent()) {
                log.error("User token policy '{}' disabled: {}", policy.policyId(), problem.get());
                skipped.put(policy.policyId(), problem.get());
                resolved.remove(policy.policyId());
            } else {
                accepted.add(policy);
            }
        }

        log.info("Authorization initialized: {} polic(ies) active, {} skipped", accepted.size(), skipped.size());
        return new AuthorizationSettings(accepted, new ArrayList<>(resolved.values()), new ArrayList<>(trusted), skipped);
    }

    private ValidatorConfig resolve(ValidatorConfig validator) {
        ValidatorConfig config = validator;
        CertificateReference reference = config.authorityCertificate();
        X509Certificate certificate = null;
        if (reference != null) {
            if (reference.subjectName() != null) {
                reference = reference.withSubjectName(reference.subjectName().replace(LOCALHOST, hostName));
                config = config.withAuthorityCertificate(reference);
            }
            certificate = certificateStore.find(reference).orElse(null);
            if (certificate == null) {
                log.warn("Authority certificate {} for policy '{}' could not be found", reference, config.policyId());
            }
        }

        if (config.issuerUri() == null) {
            String derived = certificate != null ? CertificateStore.applicationUri(certificate).orElse(null) : null;
            config = config.withIssuerUri(derived);
        } else {
            config = config.withIssuerUri(config.issuerUri().replace(LOCALHOST, hostName));
        }
        return config;
    }

    private Optional<ServiceError> loadTrustList(
            TokenPolicy policy, Map<String, String> trustLists, Set<X509Certificate> trusted) {
        String storePath = trustLists.get(policy.policyId());
        if (storePath == null || storePath.isBlank()) {
            return Optional.of(issuerCertificatesMissing(policy, "(none)"));
        }
        List<X509Certificate> certificates = certificateStore.certificates(storePath);
        if (certificates.isEmpty()) {
            return Optional.of(issuerCertificatesMissing(policy, storePath));
        }
        trusted.addAll(certificates);
        return Optional.empty();
    }

    private static Optional<ServiceError> checkIssued(TokenPolicy policy, Map<String, ValidatorConfig> resolved) {
        if (!policy.isBearerTokenPolicy()) {
            return Optional.empty();
        }
        if (!resolved.containsKey(policy.policyId())) {
            return Optional.of(ServiceError.of(ErrorKind.CONFIGURATION_ERROR,
                    StatusCode.BAD_CONFIGURATION_ERROR, "ValidatorMissing", policy.policyId()));
        }
        try {
            BearerTokenParameters.fromJson(policy.issuerEndpointUrl());
        } catch (BearerTokenParameters.MalformedParametersException e) {
            return Optional.of(ServiceError.of(ErrorKind.CONFIGURATION_ERROR,
                    StatusCode.BAD_CONFIGURATION_ERROR, "InvalidTokenParameters", policy.policyId()).withCause(e));
        }
        return Optional.empty();
    }

    private static ServiceError issuerCertificatesMissing(TokenPolicy policy, String storePath) {
        return ServiceError.of(ErrorKind.CONFIGURATION_ERROR,
                StatusCode.BAD_CERTIFICATE_INVALID, "IssuerCertificatesMissing", policy.policyId(), storePath);
    }
}
