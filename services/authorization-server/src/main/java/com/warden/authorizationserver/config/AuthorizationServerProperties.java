package com.warden.authorizationserver.config;

import com.warden.security.CertificateReference;
import com.warden.security.CredentialKind;
import com.warden.security.RoleId;
import com.warden.security.RoleMappingTable;
import com.warden.security.TokenPolicy;
import com.warden.security.ValidatorConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Authorization configuration, bound from {@code warden.authorization.*}.
 *
 * <pre>
 * warden:
 *   authorization:
 *     application-uri: urn:localhost:warden:server
 *     policies:
 *       - id: anonymous
 *         kind: ANONYMOUS
 *       - id: jwt
 *         kind: ISSUED
 *         issued-token-type: http://opcfoundation.org/UA/UserToken#JWT
 *     validators:
 *       - policy-id: jwt
 *         issuer-endpoint-url: '{"ua:authorityUrl":"https://localhost:54333/login"}'
 *         authority-certificate:
 *           store-path: pki/authorities
 *           subject-name: localhost
 *     trust-lists:
 *       certificate: pki/trusted
 *     role-mappings:
 *       scopes:
 *         UAServer: [Observer]
 * </pre>
 *
 * @param applicationUri this server's application URI, used as the bearer token audience. Required.
 * @param serverName     value of the {@code server} metric tag
 * @param hostName       replaces "localhost" in validator entries; defaults to the machine's host name
 * @param policies       user token policies the endpoints advertise
 * @param validators     verification settings for issued token policies
 * @param trustLists     certificate store directory per certificate policy id
 * @param roleMappings   additions to (or replacements of) the stock role tables
 */
@ConfigurationProperties(prefix = "warden.authorization")
@Validated
public record AuthorizationServerProperties(
        @NotBlank String applicationUri,
        String serverName,
        String hostName,
        @Valid List<Policy> policies,
        @Valid List<Validator> validators,
        Map<String, String> trustLists,
        @Valid RoleMappings roleMappings) {

    public AuthorizationServerProperties {
        if (serverName == null || serverName.isBlank()) {
            serverName = "warden-authorization-server";
        }
        if (policies == null || policies.isEmpty()) {
            policies = List.of(new Policy("anonymous", CredentialKind.ANONYMOUS, null, null, null));
        }
        if (validators == null) {
            validators = List.of();
        }
        if (trustLists == null) {
            trustLists = Map.of();
        }
        if (roleMappings == null) {
            roleMappings = new RoleMappings(null, null, null, null);
        }
    }

    public List<TokenPolicy> tokenPolicies() {
        return policies.stream().map(Policy::toTokenPolicy).toList();
    }

    public List<ValidatorConfig> validatorConfigs() {
        return validators.stream().map(Validator::toValidatorConfig).toList();
    }

    /**
     * @param id                policy id, unique per server
     * @param kind              credential kind the policy accepts
     * @param issuedTokenType   token profile URI for ISSUED policies
     * @param issuerEndpointUrl bearer token parameters JSON; usually supplied by the validator entry instead
     * @param securityPolicyUri security policy for token encryption
     */
    public record Policy(
            @NotBlank String id,
            @NotNull CredentialKind kind,
            String issuedTokenType,
            String issuerEndpointUrl,
            String securityPolicyUri) {

        TokenPolicy toTokenPolicy() {
            return new TokenPolicy(id, kind, issuedTokenType, issuerEndpointUrl, securityPolicyUri);
        }
    }

    /**
     * @param policyId             the issued token policy this entry configures
     * @param authorityCertificate where to find the token authority's certificate
     * @param issuerUri            expected issuer; derived from the authority certificate when absent
     * @param issuerEndpointUrl    bearer token parameters JSON copied onto the policy
     */
    public record Validator(
            @NotBlank String policyId,
            @Valid Certificate authorityCertificate,
            String issuerUri,
            String issuerEndpointUrl) {

        ValidatorConfig toValidatorConfig() {
            return new ValidatorConfig(policyId,
                    authorityCertificate != null ? authorityCertificate.toReference() : null,
                    issuerUri, issuerEndpointUrl);
        }
    }

    /**
     * @param storePath   certificate store directory
     * @param subjectName subject distinguished name or common name
     * @param thumbprint  SHA-1 thumbprint; wins over the subject name
     */
    public record Certificate(@NotBlank String storePath, String subjectName, String thumbprint) {

        CertificateReference toReference() {
            return new CertificateReference(storePath, subjectName, thumbprint);
        }
    }

    /**
     * Role names are matched case-insensitively against browse names ("SecurityAdmin") or
     * constant names ("SECURITY_ADMIN").
     *
     * @param includeDefaults whether the stock mappings are kept (default true)
     * @param scopes          scope claim to role names
     * @param users           user name to role names
     * @param roles           role claim (directory group) to role names
     */
    public record RoleMappings(
            Boolean includeDefaults,
            Map<String, List<String>> scopes,
            Map<String, List<String>> users,
            Map<String, List<String>> roles) {

        public RoleMappings {
            if (includeDefaults == null) {
                includeDefaults = Boolean.TRUE;
            }
            scopes = scopes == null ? Map.of() : scopes;
            users = users == null ? Map.of() : users;
            roles = roles == null ? Map.of() : roles;
        }

        /**
         * Builds the role table.
         *
         * @throws IllegalArgumentException if a mapping names an unknown role or grants none
         */
        public RoleMappingTable toTable() {
            RoleMappingTable.Builder builder = RoleMappingTable.builder();
            if (includeDefaults) {
                RoleMappingTable defaults = RoleMappingTable.defaults();
                defaults.scopes().forEach(builder::scope);
                defaults.users().forEach(builder::user);
                defaults.roles().forEach(builder::role);
            }
            scopes.forEach((scope, names) -> builder.scope(scope, resolve(scope, names)));
            users.forEach((user, names) -> builder.user(user, resolve(user, names)));
            roles.forEach((role, names) -> builder.role(role, resolve(role, names)));
            return builder.build();
        }

        private static List<RoleId> resolve(String key, Collection<String> names) {
            if (names == null) {
                return List.of();
            }
            return names.stream()
                    .map(name -> RoleId.fromString(name).orElseThrow(() ->
                            new IllegalArgumentException("mapping for '" + key + "' names unknown role '" + name + "'")))
                    .toList();
        }
    }

    /** Policy ids configured more than once, which is a configuration mistake. */
    public Set<String> duplicatePolicyIds() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Policy policy : policies) {
            if (!seen.add(policy.id())) {
                duplicates.add(policy.id());
            }
        }
        return duplicates;
    }
}
