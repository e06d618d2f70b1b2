package com.warden.security;

/**
 * Carries a {@link ServiceError} to hosts that propagate failures as exceptions.
 */
public class ServiceResultException extends RuntimeException {

    private final ServiceError error;

    public ServiceResultException(ServiceError error) {
        super(error.toString(), error.cause());
        this.error = error;
    }

    public ServiceError error() {
        return error;
    }

    public StatusCode statusCode() {
        return error.statusCode();
    }
}
