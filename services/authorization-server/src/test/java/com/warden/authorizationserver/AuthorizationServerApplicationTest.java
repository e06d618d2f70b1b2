package com.warden.authorizationserver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.warden.security.AnonymousCredential;
import com.warden.security.AuthorizationMetrics;
import com.warden.security.AuthorizationService;
import com.warden.security.RoleId;
import com.warden.security.RoleMapper;
import com.warden.security.StatusCode;
import com.warden.security.TokenPolicy;
import com.warden.security.testing.TestIdentityFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Authorization Server Application")
class AuthorizationServerApplicationTest {

    @Autowired private AuthorizationService authorizationService;
    @Autowired private MeterRegistry meterRegistry;
    @Autowired private MockMvc mockMvc;
    @Autowired private RoleMapper roleMapper;

    @Test
    @DisplayName("skips the certificate policy without a trust list and keeps the others")
    void settingsFromTestProfile() {
        var settings = authorizationService.settings();

        assertThat(settings.policies()).extracting(TokenPolicy::policyId)
                .containsExactly("anonymous", "username", "certificate", "jwt");
        assertThat(settings.skippedPolicyIds()).containsExactly("orphan-certificate");
        assertThat(settings.trustedCertificates()).hasSize(1);
    }

    @Test
    @DisplayName("derives the bearer token issuer from the authority certificate")
    void issuerDerived() {
        assertThat(authorizationService.settings().validators()).singleElement()
                .satisfies(v -> assertThat(v.issuerUri()).isEqualTo("urn:localhost:warden:authority"));
    }

    @Test
    @DisplayName("anonymous session activation yields the Anonymous role and is counted")
    void anonymousActivation() {
        var result = authorizationService.impersonateUser("anonymous", new AnonymousCredential());

        assertThat(result.value().roles()).containsExactly(RoleId.ANONYMOUS);
        assertThat(meterRegistry.find(AuthorizationMetrics.ACCEPTED).tag("server", "warden-test").counter())
                .isNotNull();
    }

    @Test
    @DisplayName("user-name writes are refused without an OS logon integration")
    void userNameWriteRefused() {
        var result = authorizationService.validateRequest(TestIdentityFactory.userNameWrite("appuser"));

        assertThat(result.error().statusCode()).isEqualTo(StatusCode.BAD_USER_ACCESS_DENIED);
        assertThat(authorizationService.registry().pendingCount()).isZero();
    }

    @Test
    @DisplayName("configured scope mappings extend the stock tables")
    void scopeMappings() {
        assertThat(roleMapper.mapScopesToRoles("maintenance UAServer"))
                .containsExactly(RoleId.ENGINEER, RoleId.OPERATOR, RoleId.OBSERVER);
    }

    @Test
    @DisplayName("policy endpoint lists active and skipped policies")
    void policiesEndpoint() throws Exception {
        mockMvc.perform(get("/api/v1/policies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.policies.length()").value(4))
                .andExpect(jsonPath("$.policies[3].policyId").value("jwt"))
                .andExpect(jsonPath("$.policies[3].authorityUrl").value("https://localhost:54333/login"))
                .andExpect(jsonPath("$.policies[3].scopes[0]").value("UAServer"))
                .andExpect(jsonPath("$.skipped[0]").value("orphan-certificate"))
                .andExpect(jsonPath("$.pendingImpersonations").value(0));
    }

    @Test
    @DisplayName("unknown policy id is a 404 problem")
    void unknownPolicy() throws Exception {
        mockMvc.perform(get("/api/v1/policies/orphan-certificate"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"));
    }

    @Test
    @DisplayName("health reports the authorization component")
    void health() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.authorization.status").value("UP"))
                .andExpect(jsonPath("$.components.authorization.details.skippedPolicies[0]")
                        .value("orphan-certificate"));
    }
}
