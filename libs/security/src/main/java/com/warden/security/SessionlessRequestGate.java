package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates requests that arrive without a session, using the bearer token carried
 * as the request's authentication token.
 * <p>
 * Steps run in order and stop at the first failure:
 * <ol>
 *   <li>the channel must be encrypted</li>
 *   <li>the endpoint must offer a bearer token policy</li>
 *   <li>that policy's parameters must parse</li>
 *   <li>the authentication token must be a string identifier in namespace 0</li>
 *   <li>the token must pass {@link CredentialValidator#validateBearerToken}</li>
 * </ol>
 */
public final class SessionlessRequestGate {

    private static final Logger log = LoggerFactory.getLogger(SessionlessRequestGate.class);

    private final CredentialValidator validator;

    public SessionlessRequestGate(CredentialValidator validator) {
        if (validator == null) {
            throw new IllegalArgumentException("validator must not be null");
        }
        this.validator = validator;
    }

    /**
     * @param endpoint the endpoint the request arrived on (null fails the channel check)
     * @param token    the request header's authentication token
     * @return the identity to execute the request under, or why the request is refused
     */
    public ValidationResult<RoleBasedIdentity> validate(EndpointDescription endpoint, AuthenticationToken token) {
        if (endpoint == null || !endpoint.isEncrypted()) {
            log.warn("Session-less request refused on unencrypted channel {}",
                    endpoint != null ? endpoint.endpointUrl() : null);
            return ValidationResult.fail(ServiceError.of(ErrorKind.SECURITY_POLICY_VIOLATION,
                    StatusCode.BAD_SECURITY_MODE_INSUFFICIENT, "SecurityModeInsufficient"));
        }

        TokenPolicy selected = endpoint.userIdentityTokens().stream()
                .filter(TokenPolicy::isBearerTokenPolicy)
                .findFirst()
                .orElse(null);
        if (selected == null) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.MISSING_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "NoBearerTokenPolicy"));
        }

        BearerTokenParameters parameters;
        try {
            parameters = BearerTokenParameters.fromJson(selected.issuerEndpointUrl());
        } catch (BearerTokenParameters.MalformedParametersException e) {
            log.error("Bearer token policy '{}' is misconfigured: {}", selected.policyId(), e.getMessage());
            return ValidationResult.fail(ServiceError.of(ErrorKind.CONFIGURATION_ERROR,
                    StatusCode.BAD_CONFIGURATION_ERROR, "InvalidTokenParameters", selected.policyId()).withCause(e));
        }

        if (token == null || token.isNull()
                || token.idType() != AuthenticationToken.IdType.STRING
                || token.namespaceIndex() != 0
                || !(token.identifier() instanceof String encoded)) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_INVALID, "IdentityTokenInvalid"));
        }

        return validator.validateBearerToken(selected, parameters, encoded);
    }
}
