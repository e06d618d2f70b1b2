package com.warden.security;

import java.util.Optional;
import java.util.function.Function;

/**
 * The hooks a protocol server calls into.
 * <p>
 * <ul>
 *   <li>{@link #impersonateUser} when a session activates with a new identity token</li>
 *   <li>{@link #validateSessionlessRequest} for requests that carry no session</li>
 *   <li>{@link #validateRequest} before every request is dispatched</li>
 *   <li>{@link #requestComplete} after every request, in a finally block</li>
 * </ul>
 * Hosts that own the dispatch call can instead hand the handler to {@link #execute}, which
 * pairs validation and completion itself.
 */
public final class AuthorizationService {

    private final AuthorizationSettings settings;
    private final CredentialValidator validator;
    private final SessionlessRequestGate sessionlessGate;
    private final WritePolicyGuard writeGuard;
    private final ImpersonationContextRegistry registry;

    public AuthorizationService(
            AuthorizationSettings settings,
            CredentialValidator validator,
            ImpersonationContextRegistry registry) {
        if (settings == null || validator == null || registry == null) {
            throw new IllegalArgumentException("settings, validator and registry must not be null");
        }
        this.settings = settings;
        this.validator = validator;
        this.registry = registry;
        this.sessionlessGate = new SessionlessRequestGate(validator);
        this.writeGuard = new WritePolicyGuard(registry);
    }

    /**
     * Validates the identity token a client activates its session with.
     *
     * @param policyId   the policy the client selected
     * @param credential the decrypted token
     * @see AuthorizationSettings#resolvePolicy
     */
    public ValidationResult<RoleBasedIdentity> impersonateUser(String policyId, UserCredential credential) {
        return settings.resolvePolicy(policyId).flatMap(policy -> validator.validate(policy, credential));
    }

    public ValidationResult<RoleBasedIdentity> validateSessionlessRequest(
            EndpointDescription endpoint, AuthenticationToken token) {
        return sessionlessGate.validate(endpoint, token);
    }

    public ValidationResult<Void> validateRequest(OperationContext context) {
        return writeGuard.onValidateRequest(context);
    }

    public void requestComplete(OperationContext context) {
        writeGuard.onRequestComplete(context);
    }

    /**
     * Validates the request, runs the handler with the request's impersonation context (if
     * one was acquired), and completes the request whether or not the handler succeeds.
     *
     * @throws ServiceResultException if validation fails; the handler is not run
     */
    public <T> T execute(OperationContext context, Function<Optional<ImpersonationContext>, T> handler) {
        try (ImpersonationContextRegistry.PendingImpersonation pending = registry.scope(context.requestId())) {
            validateRequest(context).orElseThrow();
            return handler.apply(pending.context());
        }
    }

    public AuthorizationSettings settings() {
        return settings;
    }

    public ImpersonationContextRegistry registry() {
        return registry;
    }
}
