package com.warden.security;

/**
 * The authentication token carried in a request header, as a node identifier.
 * <p>
 * For session-less requests the token is a string identifier in namespace 0 whose value
 * is the encoded bearer token.
 *
 * @param namespaceIndex namespace of the identifier
 * @param idType         identifier type
 * @param identifier     the identifier value (a {@link String} for {@link IdType#STRING})
 */
public record AuthenticationToken(int namespaceIndex, IdType idType, Object identifier) {

    /** Node identifier types. */
    public enum IdType {
        NUMERIC,
        STRING,
        GUID,
        OPAQUE
    }

    /** A string identifier in namespace 0. */
    public static AuthenticationToken ofString(String value) {
        return new AuthenticationToken(0, IdType.STRING, value);
    }

    /** True for the null node id: no identifier, or a zero/empty identifier in namespace 0. */
    public boolean isNull() {
        if (identifier == null || idType == null) {
            return true;
        }
        if (namespaceIndex != 0) {
            return false;
        }
        if (identifier instanceof Number number) {
            return number.longValue() == 0;
        }
        if (identifier instanceof String text) {
            return text.isEmpty();
        }
        if (identifier instanceof byte[] bytes) {
            return bytes.length == 0;
        }
        return false;
    }

    @Override
    public String toString() {
        return "AuthenticationToken[ns=" + namespaceIndex + ", idType=" + idType + "]";
    }
}
