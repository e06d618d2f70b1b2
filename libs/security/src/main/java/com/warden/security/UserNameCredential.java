package com.warden.security;

import java.util.Arrays;

/**
 * A user name and decrypted password.
 * <p>
 * The password array is owned by the credential; {@link #clearPassword()} wipes it once
 * the credential is no longer needed.
 *
 * @param userName the user name, optionally qualified ("DOMAIN\\user" or "user@domain")
 * @param password the decrypted password
 */
public record UserNameCredential(String userName, char[] password) implements UserCredential {

    public UserNameCredential {
        if (userName == null || userName.isBlank()) {
            throw new IllegalArgumentException("userName must not be null or blank");
        }
        password = password == null ? new char[0] : password;
    }

    @Override
    public CredentialKind kind() {
        return CredentialKind.USER_NAME;
    }

    public void clearPassword() {
        Arrays.fill(password, '\0');
    }

    @Override
    public String toString() {
        return "UserNameCredential[userName=" + userName + "]";
    }
}
