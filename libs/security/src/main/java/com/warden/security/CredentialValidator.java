package com.warden.security;

import com.warden.observability.RequestLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates user identity tokens and converts them into {@link RoleBasedIdentity} instances.
 * <p>
 * Dispatch is by credential variant, with no fallback from one variant to another. Each
 * handler returns a {@link ValidationResult}; a failure carries the status code and
 * localized message to surface to the client.
 * <p>
 * Collaborators that verify credentials are optional: a validator built without, say, a
 * {@link BearerTokenVerifier} rejects every bearer token. Validation calls block on those
 * collaborators and run on the caller's thread. Instances are immutable and thread-safe.
 */
public final class CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private static final String ANONYMOUS_DISPLAY_NAME = "Anonymous";

    private final RoleMapper roleMapper;
    private final Map<String, ValidatorConfig> validators;
    private final String applicationUri;
    private final CertificateStore certificateStore;
    private final CertificateTrustValidator trustValidator;
    private final BearerTokenVerifier tokenVerifier;
    private final TicketAuthenticator ticketAuthenticator;
    private final UserNameAuthenticator userNameAuthenticator;
    private final AuthorizationMetrics metrics;
    private final WsSecurityTicketDecoder ticketDecoder = new WsSecurityTicketDecoder();

    private CredentialValidator(Builder builder) {
        this.roleMapper = builder.roleMapper;
        this.validators = Map.copyOf(builder.validators);
        this.applicationUri = builder.applicationUri;
        this.certificateStore = builder.certificateStore;
        this.trustValidator = builder.trustValidator;
        this.tokenVerifier = builder.tokenVerifier;
        this.ticketAuthenticator = builder.ticketAuthenticator;
        this.userNameAuthenticator = builder.userNameAuthenticator;
        this.metrics = builder.metrics;
    }

    public static Builder builder(RoleMapper roleMapper, String applicationUri) {
        return new Builder(roleMapper, applicationUri);
    }

    /**
     * Validates a credential presented under a policy.
     *
     * @param policy     the policy the client selected; required for issued tokens
     * @param credential the decrypted credential
     * @return the identity, or the reason the credential was rejected
     */
    public ValidationResult<RoleBasedIdentity> validate(TokenPolicy policy, UserCredential credential) {
        String policyId = policy != null ? policy.policyId() : null;
        return RequestLogContext.callWithPolicy(policyId, () -> {
            if (credential == null) {
                return metrics.record(null, rejected("IdentityTokenRejected"));
            }
            ValidationResult<RoleBasedIdentity> result = metrics.time(credential.kind(), () -> dispatch(policy, credential));
            if (result.valid()) {
                log.info("{} token accepted: {}", credential.kind(), result.value().displayName());
            } else {
                log.warn("{} token rejected: {}", credential.kind(), result.error());
            }
            return metrics.record(credential.kind(), result);
        });
    }

    private ValidationResult<RoleBasedIdentity> dispatch(TokenPolicy policy, UserCredential credential) {
        if (policy != null && policy.kind() != credential.kind()) {
            return rejected("IdentityTokenRejected");
        }
        if (credential instanceof AnonymousCredential) {
            return validateAnonymous();
        }
        if (credential instanceof UserNameCredential userName) {
            return validateUserName(userName);
        }
        if (credential instanceof CertificateCredential certificate) {
            return validateCertificate(certificate.certificate());
        }
        if (credential instanceof IssuedTokenCredential issued) {
            return validateIssuedToken(policy, issued);
        }
        return rejected("IdentityTokenRejected");
    }

    /**
     * Anonymous tokens always validate, with the {@link RoleId#ANONYMOUS} role only.
     */
    public ValidationResult<RoleBasedIdentity> validateAnonymous() {
        return ValidationResult.ok(RoleBasedIdentity.of(
                BaseIdentity.of(ANONYMOUS_DISPLAY_NAME, CredentialKind.ANONYMOUS), List.of(RoleId.ANONYMOUS)));
    }

    /**
     * Checks a user certificate against the trust list. Trusted certificates get
     * {@link RoleId#AUTHENTICATED_USER} plus the roles mapped to the subject's common name.
     */
    public ValidationResult<RoleBasedIdentity> validateCertificate(X509Certificate certificate) {
        if (certificate == null) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidCertificate", ""));
        }
        String subject = certificate.getSubjectX500Principal().getName();
        if (trustValidator == null) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidCertificate", subject));
        }
        try {
            trustValidator.validate(certificate);
        } catch (CertificateException | RuntimeException e) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidCertificate", subject).withCause(e));
        }
        Set<RoleId> roles = authenticatedRoles();
        CertificateStore.commonName(certificate).ifPresent(cn -> roles.addAll(roleMapper.mapUserToRoles(cn)));
        return ValidationResult.ok(RoleBasedIdentity.of(BaseIdentity.of(subject, CredentialKind.CERTIFICATE), roles));
    }

    /**
     * Checks a user name and password with the user directory. Valid users get
     * {@link RoleId#AUTHENTICATED_USER}, the roles mapped to their account name, and the
     * roles mapped to each group the directory reports.
     */
    public ValidationResult<RoleBasedIdentity> validateUserName(UserNameCredential credential) {
        if (userNameAuthenticator == null) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidUserName", credential.userName()));
        }
        List<String> roleClaims;
        try {
            roleClaims = userNameAuthenticator.authenticate(credential);
        } catch (LogonException e) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidUserName", credential.userName()).withCause(e));
        }
        Set<RoleId> roles = authenticatedRoles();
        roles.addAll(roleMapper.mapUserToRoles(accountName(credential.userName())));
        roles.addAll(roleMapper.mapRoleClaimsToRoles(roleClaims));
        return ValidationResult.ok(RoleBasedIdentity.of(
                BaseIdentity.of(credential.userName(), CredentialKind.USER_NAME), roles));
    }

    private ValidationResult<RoleBasedIdentity> validateIssuedToken(TokenPolicy policy, IssuedTokenCredential credential) {
        if (policy == null) {
            return rejected("IdentityTokenRejected");
        }
        String tokenType = credential.issuedTokenType() != null ? credential.issuedTokenType() : policy.issuedTokenType();
        if (policy.issuedTokenType() != null && !policy.issuedTokenType().equals(tokenType)) {
            return rejected("IdentityTokenRejected");
        }
        if (TokenProfiles.JWT_USER_TOKEN.equals(tokenType)) {
            BearerTokenParameters parameters;
            try {
                parameters = BearerTokenParameters.fromJson(policy.issuerEndpointUrl());
            } catch (BearerTokenParameters.MalformedParametersException e) {
                return invalidParameters(policy, e);
            }
            return validateBearerToken(policy, parameters, credential.tokenText());
        }
        if (TokenProfiles.KERBEROS_TICKET.equals(tokenType)) {
            return validateLegacyTicket(credential.tokenData());
        }
        return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "UnsupportedTokenType", String.valueOf(tokenType)));
    }

    /**
     * Verifies a bearer token with the authority named in the policy's parameters.
     * <p>
     * The authority certificate and issuer URI come from the policy's {@link ValidatorConfig};
     * either may be absent, in which case the verifier applies its defaults. A verified token
     * grants {@link RoleId#AUTHENTICATED_USER} plus the roles mapped to each entry of its
     * {@code scp} claim.
     *
     * @param policy     the bearer token policy
     * @param parameters the policy's parsed endpoint parameters
     * @param token      the encoded token
     */
    public ValidationResult<RoleBasedIdentity> validateBearerToken(
            TokenPolicy policy, BearerTokenParameters parameters, String token) {
        if (policy == null || parameters == null) {
            return rejected("IdentityTokenRejected");
        }
        URI authority;
        try {
            authority = parameters.authorityUri();
        } catch (BearerTokenParameters.MalformedParametersException e) {
            return invalidParameters(policy, e);
        }
        if (tokenVerifier == null || token == null || token.isBlank()) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidBearerToken", authority));
        }

        ValidatorConfig config = validators.get(policy.policyId());
        X509Certificate authorityCertificate = null;
        String issuerUri = null;
        if (config != null) {
            authorityCertificate = resolveAuthorityCertificate(config).orElse(null);
            issuerUri = config.issuerUri();
        }

        VerifiedToken verified;
        try {
            verified = tokenVerifier.verify(authority, authorityCertificate, issuerUri, applicationUri, token);
        } catch (TokenVerificationException e) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                    StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidBearerToken", authority).withCause(e));
        }
        if (!(verified instanceof ClaimsToken claims)) {
            return ValidationResult.fail(ServiceError.of(ErrorKind.INTERNAL_INCONSISTENCY,
                    StatusCode.BAD_INTERNAL_ERROR, "UnexpectedTokenType", authority));
        }

        Set<RoleId> roles = authenticatedRoles();
        claims.claim(ClaimsToken.SCOPE_CLAIM).ifPresent(scopes -> roles.addAll(roleMapper.mapScopesToRoles(scopes)));
        return ValidationResult.ok(RoleBasedIdentity.of(
                new BaseIdentity(claims.displayName(), CredentialKind.ISSUED, TokenProfiles.JWT_USER_TOKEN), roles));
    }

    /**
     * Decodes a WS-Security envelope and authenticates the Kerberos ticket inside it.
     * Tickets the authenticator does not claim are accepted unchecked with
     * {@link RoleId#AUTHENTICATED_USER} only, named after the ticket id (or its value type).
     * Without any authenticator the ticket is rejected.
     */
    public ValidationResult<RoleBasedIdentity> validateLegacyTicket(byte[] tokenData) {
        String rootElement = null;
        try {
            WsSecurityTicketDecoder.DecodedTicket decoded = ticketDecoder.decode(tokenData);
            rootElement = decoded.rootElement();
            ReceiverTicket ticket = decoded.ticket();
            if (ticketAuthenticator == null) {
                throw new TokenVerificationException("no ticket authenticator configured");
            }
            if (!ticketAuthenticator.canValidate(ticket)) {
                log.debug("Ticket type {} not claimed by the authenticator, accepting unchecked", ticket.valueType());
                String displayName = ticket.id() != null ? ticket.id() : ticket.valueType();
                return ValidationResult.ok(RoleBasedIdentity.of(
                        new BaseIdentity(displayName, CredentialKind.ISSUED, TokenProfiles.KERBEROS_TICKET),
                        authenticatedRoles()));
            }
            String principal = ticketAuthenticator.validate(ticket);
            Set<RoleId> roles = authenticatedRoles();
            roles.addAll(roleMapper.mapUserToRoles(accountName(principal)));
            return ValidationResult.ok(RoleBasedIdentity.of(
                    new BaseIdentity(principal, CredentialKind.ISSUED, TokenProfiles.KERBEROS_TICKET), roles));
        } catch (WsSecurityTicketDecoder.TicketDecodingException e) {
            return invalidTicket(e.rootElement(), e);
        } catch (TokenVerificationException | RuntimeException e) {
            return invalidTicket(rootElement, e);
        }
    }

    /** The verification settings for a policy, if any were configured. */
    public Optional<ValidatorConfig> validatorConfig(String policyId) {
        return Optional.ofNullable(validators.get(policyId));
    }

    public String applicationUri() {
        return applicationUri;
    }

    public RoleMapper roleMapper() {
        return roleMapper;
    }

    private Optional<X509Certificate> resolveAuthorityCertificate(ValidatorConfig config) {
        if (config.authorityCertificate() == null || certificateStore == null) {
            return Optional.empty();
        }
        Optional<X509Certificate> certificate = certificateStore.find(config.authorityCertificate());
        if (certificate.isEmpty()) {
            log.warn("Authority certificate {} not found, verifier defaults apply", config.authorityCertificate());
        }
        return certificate;
    }

    private static Set<RoleId> authenticatedRoles() {
        Set<RoleId> roles = new LinkedHashSet<>();
        roles.add(RoleId.AUTHENTICATED_USER);
        return roles;
    }

    /** Strips a Windows domain prefix or Kerberos realm suffix from an account name. */
    static String accountName(String userName) {
        String name = userName;
        int backslash = name.lastIndexOf('\\');
        if (backslash >= 0) {
            name = name.substring(backslash + 1);
        }
        int at = name.indexOf('@');
        if (at > 0) {
            name = name.substring(0, at);
        }
        return name;
    }

    private static ValidationResult<RoleBasedIdentity> rejected(String symbolicId) {
        return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                StatusCode.BAD_IDENTITY_TOKEN_REJECTED, symbolicId));
    }

    private static ValidationResult<RoleBasedIdentity> invalidTicket(String rootElement, Exception cause) {
        return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                StatusCode.BAD_IDENTITY_TOKEN_REJECTED, "InvalidKerberosToken",
                rootElement != null ? rootElement : "").withCause(cause));
    }

    private static ValidationResult<RoleBasedIdentity> invalidParameters(TokenPolicy policy, Exception cause) {
        log.error("Bearer token parameters of policy '{}' are unusable: {}", policy.policyId(), cause.getMessage());
        return ValidationResult.fail(ServiceError.of(ErrorKind.CONFIGURATION_ERROR,
                StatusCode.BAD_CONFIGURATION_ERROR, "InvalidTokenParameters", policy.policyId()).withCause(cause));
    }

    /**
     * Assembles a {@link CredentialValidator}. Collaborators left unset disable the
     * credential variants that need them.
     */
    public static final class Builder {

        private final RoleMapper roleMapper;
        private final String applicationUri;
        private final Map<String, ValidatorConfig> validators = new LinkedHashMap<>();
        private CertificateStore certificateStore;
        private CertificateTrustValidator trustValidator;
        private BearerTokenVerifier tokenVerifier;
        private TicketAuthenticator ticketAuthenticator;
        private UserNameAuthenticator userNameAuthenticator;
        private AuthorizationMetrics metrics = AuthorizationMetrics.detached();

        private Builder(RoleMapper roleMapper, String applicationUri) {
            if (roleMapper == null) {
                throw new IllegalArgumentException("roleMapper must not be null");
            }
            if (applicationUri == null || applicationUri.isBlank()) {
                throw new IllegalArgumentException("applicationUri must not be null or blank");
            }
            this.roleMapper = roleMapper;
            this.applicationUri = applicationUri;
        }

        public Builder validators(Collection<ValidatorConfig> configs) {
            for (ValidatorConfig config : configs) {
                validators.put(config.policyId(), config);
            }
            return this;
        }

        public Builder certificateStore(CertificateStore store) {
            this.certificateStore = store;
            return this;
        }

        public Builder trustValidator(CertificateTrustValidator validator) {
            this.trustValidator = validator;
            return this;
        }

        public Builder tokenVerifier(BearerTokenVerifier verifier) {
            this.tokenVerifier = verifier;
            return this;
        }

        public Builder ticketAuthenticator(TicketAuthenticator authenticator) {
            this.ticketAuthenticator = authenticator;
            return this;
        }

        public Builder userNameAuthenticator(UserNameAuthenticator authenticator) {
            this.userNameAuthenticator = authenticator;
            return this;
        }

        public Builder metrics(AuthorizationMetrics authorizationMetrics) {
            if (authorizationMetrics == null) {
                throw new IllegalArgumentException("metrics must not be null");
            }
            this.metrics = authorizationMetrics;
            return this;
        }

        public CredentialValidator build() {
            return new CredentialValidator(this);
        }
    }
}
