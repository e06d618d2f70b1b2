package com.warden.security;

import com.warden.observability.RequestLogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pre-dispatch and completion hooks enforcing that writes are made by authenticated users.
 * <p>
 * A write from a user-name identity is executed under that user's OS account: the guard
 * logs the user on before dispatch and parks the impersonation context in the registry,
 * where the write handler picks it up. {@link #onRequestComplete} must be called for every
 * request, including those whose validation failed.
 */
public final class WritePolicyGuard {

    private static final Logger log = LoggerFactory.getLogger(WritePolicyGuard.class);

    private final ImpersonationContextRegistry registry;

    public WritePolicyGuard(ImpersonationContextRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Validates a request before dispatch. Only writes are checked; other request types pass.
     *
     * @return a passing result, or access denied for anonymous writers and failed OS logons
     * @throws IllegalStateException if an impersonation context is already pending for the request id
     */
    public ValidationResult<Void> onValidateRequest(OperationContext context) {
        if (!context.requestType().isWrite()) {
            return ValidationResult.ok();
        }
        return RequestLogContext.callWithRequest(Long.toString(context.requestId()), () -> validateWrite(context));
    }

    private ValidationResult<Void> validateWrite(OperationContext context) {
        RoleBasedIdentity identity = context.identity();
        if (identity == null || identity.isAnonymous()) {
            log.warn("Write refused: no user identity");
            return ValidationResult.fail(ServiceError.of(ErrorKind.MISSING_CREDENTIAL,
                    StatusCode.BAD_USER_ACCESS_DENIED, "NoWriteAllowed"));
        }

        if (context.credential() instanceof UserNameCredential userName) {
            try {
                registry.acquire(context.requestId(), userName);
            } catch (LogonException e) {
                log.warn("Write refused: {}", e.getMessage());
                return ValidationResult.fail(ServiceError.of(ErrorKind.INVALID_CREDENTIAL,
                        StatusCode.BAD_USER_ACCESS_DENIED, "InvalidUserName", userName.userName()).withCause(e));
            }
        }
        return ValidationResult.ok();
    }

    /**
     * Releases whatever the request acquired. Safe to call for requests that acquired nothing.
     */
    public void onRequestComplete(OperationContext context) {
        registry.release(context.requestId());
    }
}
