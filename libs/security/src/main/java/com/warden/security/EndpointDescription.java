package com.warden.security;

import java.util.List;
import java.util.Locale;

/**
 * Security description of the endpoint a request arrived on.
 *
 * @param endpointUrl        the endpoint URL (e.g., "opc.tcp://host:4840", "https://host/ua")
 * @param securityPolicyUri  security policy of the secure channel
 * @param securityMode       message protection of the secure channel
 * @param userIdentityTokens token policies the endpoint accepts
 */
public record EndpointDescription(
        String endpointUrl,
        String securityPolicyUri,
        MessageSecurityMode securityMode,
        List<TokenPolicy> userIdentityTokens
) {

    public EndpointDescription {
        userIdentityTokens = userIdentityTokens == null ? List.of() : List.copyOf(userIdentityTokens);
        securityMode = securityMode == null ? MessageSecurityMode.INVALID : securityMode;
    }

    /** True if the endpoint URL uses a TLS transport. */
    public boolean usesSecureTransport() {
        if (endpointUrl == null) {
            return false;
        }
        String url = endpointUrl.strip().toLowerCase(Locale.ROOT);
        return url.startsWith("https:") || url.startsWith("opc.https:") || url.startsWith("opc.wss:");
    }

    /**
     * True if messages on this channel are encrypted: either the channel applies a security
     * policy or the transport is TLS, and the channel is not limited to signing. A channel
     * with a security policy but mode {@link MessageSecurityMode#NONE} counts as encrypted.
     */
    public boolean isEncrypted() {
        boolean protectedChannel = (securityPolicyUri != null && !TokenProfiles.SECURITY_POLICY_NONE.equals(securityPolicyUri))
                || usesSecureTransport();
        return protectedChannel
                && securityMode != MessageSecurityMode.SIGN
                && securityMode != MessageSecurityMode.INVALID;
    }
}
