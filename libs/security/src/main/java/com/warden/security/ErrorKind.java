package com.warden.security;

/**
 * Classification of validation failures.
 */
public enum ErrorKind {

    /** A policy's configuration is missing or unusable. */
    CONFIGURATION_ERROR,

    /** A session-less request arrived over a channel that is not encrypted. */
    SECURITY_POLICY_VIOLATION,

    /** A certificate, bearer token, ticket or password was untrusted, unparseable or expired. */
    INVALID_CREDENTIAL,

    /** A write arrived without authentication, or no bearer token policy is configured. */
    MISSING_CREDENTIAL,

    /** A verified token was not of the expected shape. */
    INTERNAL_INCONSISTENCY
}
