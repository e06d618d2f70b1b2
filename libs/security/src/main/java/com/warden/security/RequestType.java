package com.warden.security;

/**
 * Service request categories the host distinguishes when validating requests.
 */
public enum RequestType {
    READ,
    WRITE,
    CALL,
    BROWSE,
    HISTORY_READ,
    HISTORY_UPDATE,
    SUBSCRIBE;

    /** True for requests that modify server state on behalf of the caller. */
    public boolean isWrite() {
        return this == WRITE;
    }
}
