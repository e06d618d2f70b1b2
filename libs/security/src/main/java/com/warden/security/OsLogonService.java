package com.warden.security;

/**
 * Logs users on to the operating system.
 * <p>
 * Logon may be slow (domain controller round trips); callers must not hold locks across it.
 */
@FunctionalInterface
public interface OsLogonService {

    /**
     * @return a new impersonation context that the caller must close
     * @throws LogonException if the credentials are rejected
     */
    ImpersonationContext logon(UserNameCredential credential) throws LogonException;
}
