package com.warden.security.testing;

import com.warden.security.BaseIdentity;
import com.warden.security.CredentialKind;
import com.warden.security.OperationContext;
import com.warden.security.RequestType;
import com.warden.security.RoleBasedIdentity;
import com.warden.security.RoleId;
import com.warden.security.UserNameCredential;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds identities and operation contexts for tests.
 * <p>
 * Lives in the main source set so that modules depending on this library can use it from
 * their own tests. The package name marks it as test-only.
 */
public final class TestIdentityFactory {

    private static final AtomicLong REQUEST_IDS = new AtomicLong(1000);

    private TestIdentityFactory() {
        // utility class
    }

    public static RoleBasedIdentity anonymous() {
        return RoleBasedIdentity.of(BaseIdentity.of("Anonymous", CredentialKind.ANONYMOUS), List.of(RoleId.ANONYMOUS));
    }

    public static RoleBasedIdentity userName(String userName, RoleId... extraRoles) {
        return withRoles(userName, CredentialKind.USER_NAME, extraRoles);
    }

    public static RoleBasedIdentity withRoles(String displayName, CredentialKind kind, RoleId... extraRoles) {
        List<RoleId> roles = new ArrayList<>();
        roles.add(RoleId.AUTHENTICATED_USER);
        roles.addAll(List.of(extraRoles));
        return RoleBasedIdentity.of(BaseIdentity.of(displayName, kind), roles);
    }

    public static UserNameCredential credential(String userName) {
        return new UserNameCredential(userName, "secret".toCharArray());
    }

    /** A write by the given user-name identity, with a fresh request id. */
    public static OperationContext userNameWrite(String userName) {
        return new OperationContext(nextRequestId(), RequestType.WRITE, userName(userName), credential(userName));
    }

    /** A write by an anonymous identity, with a fresh request id. */
    public static OperationContext anonymousWrite() {
        return new OperationContext(nextRequestId(), RequestType.WRITE, anonymous(), null);
    }

    public static long nextRequestId() {
        return REQUEST_IDS.incrementAndGet();
    }
}
