package com.warden.security;

/**
 * Message protection applied by a secure channel.
 */
public enum MessageSecurityMode {
    INVALID,
    NONE,
    SIGN,
    SIGN_AND_ENCRYPT
}
