package com.warden.authorizationserver.infrastructure.logon;

import com.warden.security.ImpersonationContext;
import com.warden.security.LogonException;
import com.warden.security.OsLogonService;
import com.warden.security.UserNameCredential;

/**
 * Used when the deployment provides no OS logon integration. Every logon fails, so writes by
 * user-name identities are refused with access denied.
 */
public class UnavailableLogonService implements OsLogonService {

    @Override
    public ImpersonationContext logon(UserNameCredential credential) throws LogonException {
        throw new LogonException(credential.userName(), "OS logon is not available on this host");
    }
}
