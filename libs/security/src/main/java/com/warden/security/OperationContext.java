package com.warden.security;

/**
 * What the host knows about a request at validation time.
 *
 * @param requestId   the request's handle, unique among in-flight requests
 * @param requestType the service request category
 * @param identity    the identity bound to the session or session-less request
 * @param credential  the credential that identity was validated from (may be null)
 */
public record OperationContext(
        long requestId,
        RequestType requestType,
        RoleBasedIdentity identity,
        UserCredential credential
) {

    public OperationContext {
        if (requestType == null) {
            throw new IllegalArgumentException("requestType must not be null");
        }
    }
}
