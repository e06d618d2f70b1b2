package com.warden.security;

/**
 * An OS security context logged on with a user's credentials.
 * <p>
 * Owns a native handle. Must be closed exactly once; {@link ImpersonationContextRegistry}
 * guarantees this for contexts it holds.
 */
public interface ImpersonationContext extends AutoCloseable {

    /** The user the context runs as. */
    String userName();

    /** Releases the native handle. */
    @Override
    void close();
}
