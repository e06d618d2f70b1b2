package com.warden.security;

/**
 * A service ticket extracted from a WS-Security envelope, as received by this server.
 *
 * @param valueType the ticket's {@code ValueType} URI
 * @param id        the {@code wsu:Id} of the token element (may be null)
 * @param ticket    the decoded ticket bytes
 */
public record ReceiverTicket(String valueType, String id, byte[] ticket) {

    @Override
    public String toString() {
        return "ReceiverTicket[valueType=" + valueType + ", id=" + id + ", length=" + ticket.length + "]";
    }
}
