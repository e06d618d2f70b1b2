package com.warden.security;

import java.util.List;

/**
 * Checks a user name and password against a user directory.
 */
@FunctionalInterface
public interface UserNameAuthenticator {

    /**
     * @return the role claims (group names) held by the user, possibly empty
     * @throws LogonException if the password is wrong or the account is unusable
     */
    List<String> authenticate(UserNameCredential credential) throws LogonException;
}
