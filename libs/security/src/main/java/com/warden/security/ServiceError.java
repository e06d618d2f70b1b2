package com.warden.security;

/**
 * Describes why a validation step failed.
 *
 * @param kind       failure classification
 * @param statusCode status code surfaced to the client
 * @param symbolicId vendor symbolic id of the message template (may be null)
 * @param message    localized message
 * @param cause      underlying exception (may be null)
 */
public record ServiceError(
        ErrorKind kind,
        StatusCode statusCode,
        String symbolicId,
        LocalizedText message,
        Throwable cause
) {

    public ServiceError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (statusCode == null || statusCode.isGood()) {
            throw new IllegalArgumentException("statusCode must be a bad status code");
        }
    }

    /**
     * Creates an error whose message comes from the template for {@code symbolicId}.
     */
    public static ServiceError of(ErrorKind kind, StatusCode statusCode, String symbolicId, Object... args) {
        return new ServiceError(kind, statusCode, symbolicId, Messages.format(symbolicId, args), null);
    }

    /** Returns a copy carrying the given cause. */
    public ServiceError withCause(Throwable newCause) {
        return new ServiceError(kind, statusCode, symbolicId, message, newCause);
    }

    @Override
    public String toString() {
        return statusCode.symbolicName() + ": " + (message != null ? message.text() : kind.name());
    }
}
