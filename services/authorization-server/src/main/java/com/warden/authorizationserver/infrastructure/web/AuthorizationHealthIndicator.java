package com.warden.authorizationserver.infrastructure.web;

import com.warden.security.AuthorizationService;
import com.warden.security.AuthorizationSettings;
import com.warden.security.TokenPolicy;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when startup left no usable user token policy; skipped policies are listed
 * as details either way.
 */
@Component("authorization")
public class AuthorizationHealthIndicator implements HealthIndicator {

    private final AuthorizationService authorizationService;

    public AuthorizationHealthIndicator(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @Override
    public Health health() {
        AuthorizationSettings settings = authorizationService.settings();
        Health.Builder builder = settings.policies().isEmpty() ? Health.down() : Health.up();
        return builder
                .withDetail("activePolicies", settings.policies().stream().map(TokenPolicy::policyId).toList())
                .withDetail("skippedPolicies", settings.skippedPolicyIds().stream().sorted().toList())
                .withDetail("pendingImpersonations", authorizationService.registry().pendingCount())
                .build();
    }
}
