package com.warden.security;

/**
 * Well-known URIs for issued token types and security policies.
 */
public final class TokenProfiles {

    /** Issued token type of JSON Web Token bearer credentials. */
    public static final String JWT_USER_TOKEN = "http://opcfoundation.org/UA/UserToken#JWT";

    /** Issued token type of WS-Security Kerberos tickets. */
    public static final String KERBEROS_TICKET =
            "http://docs.oasis-open.org/wss/oasis-wss-kerberos-token-profile-1.1";

    /** Security policy of a channel that neither signs nor encrypts. */
    public static final String SECURITY_POLICY_NONE = "http://opcfoundation.org/UA/SecurityPolicy#None";

    private TokenProfiles() {
        // constants
    }
}
