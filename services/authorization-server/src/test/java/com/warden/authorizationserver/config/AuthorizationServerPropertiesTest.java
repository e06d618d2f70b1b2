package com.warden.authorizationserver.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.security.CredentialKind;
import com.warden.security.RoleId;
import com.warden.security.TokenProfiles;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuthorizationServerProperties")
class AuthorizationServerPropertiesTest {

    @Test
    @DisplayName("applies defaults for optional fields")
    void defaults() {
        var props = new AuthorizationServerProperties("urn:test", null, null, null, null, null, null);

        assertThat(props.serverName()).isEqualTo("warden-authorization-server");
        assertThat(props.tokenPolicies()).singleElement()
                .satisfies(p -> assertThat(p.kind()).isEqualTo(CredentialKind.ANONYMOUS));
        assertThat(props.validatorConfigs()).isEmpty();
        assertThat(props.trustLists()).isEmpty();
        assertThat(props.roleMappings().includeDefaults()).isTrue();
    }

    @Test
    @DisplayName("converts policies and validator entries")
    void conversion() {
        var props = new AuthorizationServerProperties("urn:test", "srv", "host",
                List.of(new AuthorizationServerProperties.Policy("jwt", CredentialKind.ISSUED,
                        TokenProfiles.JWT_USER_TOKEN, null, null)),
                List.of(new AuthorizationServerProperties.Validator("jwt",
                        new AuthorizationServerProperties.Certificate("pki/authorities", "localhost", null),
                        null, "{\"ua:authorityUrl\":\"https://auth\"}")),
                Map.of(), null);

        assertThat(props.tokenPolicies()).singleElement()
                .satisfies(p -> assertThat(p.isBearerTokenPolicy()).isTrue());
        assertThat(props.validatorConfigs()).singleElement()
                .satisfies(v -> {
                    assertThat(v.authorityCertificate().storePath()).isEqualTo("pki/authorities");
                    assertThat(v.issuerEndpointUrl()).contains("https://auth");
                });
    }

    @Test
    @DisplayName("reports duplicate policy ids")
    void duplicates() {
        var policy = new AuthorizationServerProperties.Policy("anon", CredentialKind.ANONYMOUS, null, null, null);
        var props = new AuthorizationServerProperties("urn:test", null, null, List.of(policy, policy), null, null, null);

        assertThat(props.duplicatePolicyIds()).containsExactly("anon");
    }

    @Nested
    @DisplayName("role mappings")
    class RoleMappings {

        @Test
        @DisplayName("extend the stock tables by default")
        void extendDefaults() {
            var mappings = new AuthorizationServerProperties.RoleMappings(null,
                    Map.of("UAServer", List.of("Operator")), null, null);

            var table = mappings.toTable();

            assertThat(table.rolesForScope("uaserver")).containsExactly(RoleId.OBSERVER, RoleId.OPERATOR);
            assertThat(table.rolesForUser("appadmin")).containsExactly(RoleId.ENGINEER);
        }

        @Test
        @DisplayName("replace the stock tables when defaults are excluded")
        void replaceDefaults() {
            var mappings = new AuthorizationServerProperties.RoleMappings(false,
                    null, Map.of("alice", List.of("SECURITY_ADMIN")), null);

            var table = mappings.toTable();

            assertThat(table.rolesForScope("UAServer")).isEmpty();
            assertThat(table.rolesForUser("ALICE")).containsExactly(RoleId.SECURITY_ADMIN);
        }

        @Test
        @DisplayName("reject unknown role names")
        void unknownRole() {
            var mappings = new AuthorizationServerProperties.RoleMappings(true,
                    null, null, Map.of("ops", List.of("Janitor")));

            assertThatThrownBy(mappings::toTable)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Janitor");
        }
    }
}
