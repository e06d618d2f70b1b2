package com.warden.security;

/**
 * Thrown when a user name and password cannot be logged on.
 */
public class LogonException extends Exception {

    private final String userName;

    public LogonException(String userName, String message) {
        this(userName, message, null);
    }

    public LogonException(String userName, String message, Throwable cause) {
        super("Logon failed for '%s': %s".formatted(userName, message), cause);
        this.userName = userName;
    }

    public String userName() {
        return userName;
    }
}
