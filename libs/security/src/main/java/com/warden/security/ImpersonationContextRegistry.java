package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the impersonation contexts of in-flight requests, keyed by request id.
 * <p>
 * One lock guards the map and is held only for insertion, lookup and removal: the OS
 * logon in {@link #acquire} and the disposal in {@link #release} run outside it so that a
 * slow domain controller never stalls unrelated requests.
 * <p>
 * The host must call {@link #release} once per request at completion, on success and
 * failure paths alike. Entries still pending at shutdown are not closed here.
 */
public final class ImpersonationContextRegistry {

    private static final Logger log = LoggerFactory.getLogger(ImpersonationContextRegistry.class);

    private final Object lock = new Object();
    private final Map<Long, ImpersonationContext> pending = new HashMap<>();
    private final OsLogonService logonService;

    public ImpersonationContextRegistry(OsLogonService logonService) {
        if (logonService == null) {
            throw new IllegalArgumentException("logonService must not be null");
        }
        this.logonService = logonService;
    }

    /**
     * Logs the user on and registers the resulting context under the request id.
     *
     * @return the registered context
     * @throws LogonException        if the OS rejects the credentials; nothing is registered
     * @throws IllegalStateException if a context is already pending for the request id
     */
    public ImpersonationContext acquire(long requestId, UserNameCredential credential) throws LogonException {
        if (credential == null) {
            throw new IllegalArgumentException("credential must not be null");
        }
        ImpersonationContext context = logonService.logon(credential);
        if (context == null) {
            throw new LogonException(credential.userName(), "logon service returned no context");
        }

        ImpersonationContext existing;
        synchronized (lock) {
            existing = pending.putIfAbsent(requestId, context);
        }
        if (existing != null) {
            context.close();
            throw new IllegalStateException("impersonation context already pending for request " + requestId);
        }
        log.debug("Impersonation context for '{}' registered", credential.userName());
        return context;
    }

    /**
     * Removes and closes the context pending for the request id. A request with no pending
     * context is ignored.
     *
     * @return true if a context was released
     */
    public boolean release(long requestId) {
        ImpersonationContext context;
        synchronized (lock) {
            context = pending.remove(requestId);
        }
        if (context == null) {
            return false;
        }
        try {
            context.close();
        } catch (RuntimeException e) {
            log.error("Failed to close impersonation context for '{}'", context.userName(), e);
        }
        log.debug("Impersonation context for '{}' released", context.userName());
        return true;
    }

    /**
     * Returns the context pending for the request id, for the handler executing the request.
     * The registry keeps ownership; callers must not close it.
     */
    public Optional<ImpersonationContext> find(long requestId) {
        synchronized (lock) {
            return Optional.ofNullable(pending.get(requestId));
        }
    }

    /**
     * Returns a handle whose {@code close()} releases the request's context, for hosts that
     * bracket request processing with try-with-resources.
     */
    public PendingImpersonation scope(long requestId) {
        return new PendingImpersonation(requestId);
    }

    /** Number of contexts currently pending. */
    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Releases one request's context on close. Closing more than once has no further effect.
     */
    public final class PendingImpersonation implements AutoCloseable {

        private final long requestId;
        private boolean closed;

        private PendingImpersonation(long requestId) {
            this.requestId = requestId;
        }

        public long requestId() {
            return requestId;
        }

        public Optional<ImpersonationContext> context() {
            return closed ? Optional.empty() : find(requestId);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                release(requestId);
            }
        }
    }
}
