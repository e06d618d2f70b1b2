package com.warden.authorizationserver.api;

import com.warden.security.AuthorizationService;
import com.warden.security.AuthorizationSettings;
import com.warden.security.BearerTokenParameters;
import com.warden.security.CredentialKind;
import com.warden.security.TokenPolicy;
import com.warden.security.ValidatorConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the effective user token policies.
 *
 * <p>Lets operators confirm after startup which policies are active, which were skipped
 * because of incomplete configuration, and which authority each bearer token policy trusts.
 */
@RestController
@RequestMapping("/api/v1/policies")
public class PolicyInfoController {

    private final AuthorizationService authorizationService;

    public PolicyInfoController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GetMapping
    public Map<String, Object> policies() {
        AuthorizationSettings settings = authorizationService.settings();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policies", settings.policies().stream().map(this::describe).toList());
        body.put("skipped", settings.skippedPolicyIds().stream().sorted().toList());
        body.put("pendingImpersonations", authorizationService.registry().pendingCount());
        return body;
    }

    @GetMapping("/{policyId}")
    public PolicyInfo policy(@PathVariable String policyId) {
        return authorizationService.settings().policy(policyId)
                .map(this::describe)
                .orElseThrow(() -> new NoSuchElementException("No active user token policy '" + policyId + "'"));
    }

    private PolicyInfo describe(TokenPolicy policy) {
        ValidatorConfig validator = authorizationService.settings().validators().stream()
                .filter(v -> v.policyId().equals(policy.policyId()))
                .findFirst()
                .orElse(null);
        String authorityUrl = null;
        List<String> scopes = List.of();
        if (policy.isBearerTokenPolicy()) {
            BearerTokenParameters parameters = BearerTokenParameters.fromJson(policy.issuerEndpointUrl());
            authorityUrl = parameters.authorityUrl();
            scopes = parameters.scopes();
        }
        return new PolicyInfo(policy.policyId(), policy.kind(), policy.issuedTokenType(), authorityUrl, scopes,
                validator != null ? validator.issuerUri() : null);
    }

    /**
     * @param policyId        the policy id
     * @param kind            accepted credential kind
     * @param issuedTokenType token profile URI for issued token policies
     * @param authorityUrl    token authority of a bearer token policy
     * @param scopes          scopes a client should request from the authority
     * @param issuerUri       expected token issuer after startup resolution
     */
    public record PolicyInfo(
            String policyId,
            CredentialKind kind,
            String issuedTokenType,
            String authorityUrl,
            List<String> scopes,
            String issuerUri) {
    }
}
