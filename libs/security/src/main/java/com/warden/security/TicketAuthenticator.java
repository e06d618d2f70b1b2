package com.warden.security;

/**
 * Authenticates Kerberos service tickets against the server's service principal.
 */
public interface TicketAuthenticator {

    /** True if this authenticator understands the ticket's value type. */
    boolean canValidate(ReceiverTicket ticket);

    /**
     * @return the authenticated client principal name
     * @throws TokenVerificationException if the ticket is not valid
     */
    String validate(ReceiverTicket ticket) throws TokenVerificationException;
}
