package com.warden.security.testing;

import com.warden.security.ImpersonationContext;
import com.warden.security.LogonException;
import com.warden.security.OsLogonService;
import com.warden.security.UserNameCredential;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An {@link OsLogonService} backed by a fixed password table, recording every context it
 * hands out so tests can check that each one was closed exactly once.
 */
public final class InMemoryLogonService implements OsLogonService {

    private final Map<String, char[]> passwords = new ConcurrentHashMap<>();
    private final List<TrackedContext> issued = new CopyOnWriteArrayList<>();

    public InMemoryLogonService withUser(String userName, String password) {
        passwords.put(userName, password.toCharArray());
        return this;
    }

    @Override
    public ImpersonationContext logon(UserNameCredential credential) throws LogonException {
        char[] expected = passwords.get(credential.userName());
        if (expected == null || !Arrays.equals(expected, credential.password())) {
            throw new LogonException(credential.userName(), "unknown user name or bad password");
        }
        TrackedContext context = new TrackedContext(credential.userName());
        issued.add(context);
        return context;
    }

    public List<TrackedContext> issued() {
        return List.copyOf(issued);
    }

    /** Number of issued contexts not yet closed. */
    public long openCount() {
        return issued.stream().filter(c -> c.closeCount() == 0).count();
    }

    /**
     * A context that counts how often it was closed.
     */
    public static final class TrackedContext implements ImpersonationContext {

        private final String userName;
        private final AtomicInteger closes = new AtomicInteger();

        TrackedContext(String userName) {
            this.userName = userName;
        }

        @Override
        public String userName() {
            return userName;
        }

        @Override
        public void close() {
            closes.incrementAndGet();
        }

        public int closeCount() {
            return closes.get();
        }
    }
}
