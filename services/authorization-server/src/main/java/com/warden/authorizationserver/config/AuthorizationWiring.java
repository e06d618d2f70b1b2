package com.warden.authorizationserver.config;

import com.warden.authorizationserver.infrastructure.logon.UnavailableLogonService;
import com.warden.observability.MetricFactory;
import com.warden.security.AuthorizationMetrics;
import com.warden.security.AuthorizationService;
import com.warden.security.AuthorizationSettings;
import com.warden.security.BearerTokenVerifier;
import com.warden.security.CertificateStore;
import com.warden.security.CertificateTrustValidator;
import com.warden.security.CredentialValidator;
import com.warden.security.ImpersonationContextRegistry;
import com.warden.security.OsLogonService;
import com.warden.security.RoleMapper;
import com.warden.security.TicketAuthenticator;
import com.warden.security.TokenPolicyInitializer;
import com.warden.security.TrustListCertificateValidator;
import com.warden.security.UserNameAuthenticator;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the authorization components from {@link AuthorizationServerProperties}.
 *
 * <p>Credential verifiers ({@link BearerTokenVerifier}, {@link TicketAuthenticator},
 * {@link UserNameAuthenticator}, {@link OsLogonService}) are integration points: a deployment
 * contributes them as beans. Without one, the credential variant it serves is rejected, and
 * without an {@link OsLogonService} user-name writes are refused.
 */
@Configuration
public class AuthorizationWiring {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationWiring.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, AuthorizationServerProperties properties) {
        return new MetricFactory(meterRegistry, properties.serverName());
    }

    @Bean
    public AuthorizationMetrics authorizationMetrics(MetricFactory metricFactory) {
        return new AuthorizationMetrics(metricFactory);
    }

    @Bean
    public RoleMapper roleMapper(AuthorizationServerProperties properties) {
        return new RoleMapper(properties.roleMappings().toTable());
    }

    @Bean
    public CertificateStore certificateStore() {
        return new CertificateStore();
    }

    @Bean
    public AuthorizationSettings authorizationSettings(
            AuthorizationServerProperties properties, CertificateStore certificateStore) {
        Set<String> duplicates = properties.duplicatePolicyIds();
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("User token policy ids configured more than once: " + duplicates);
        }
        var initializer = new TokenPolicyInitializer(certificateStore, hostName(properties));
        return initializer.initialize(
                properties.tokenPolicies(), properties.validatorConfigs(), properties.trustLists());
    }

    @Bean
    public CertificateTrustValidator certificateTrustValidator(AuthorizationSettings settings) {
        return new TrustListCertificateValidator(settings.trustedCertificates());
    }

    @Bean
    public CredentialValidator credentialValidator(
            AuthorizationServerProperties properties,
            AuthorizationSettings settings,
            RoleMapper roleMapper,
            CertificateStore certificateStore,
            CertificateTrustValidator trustValidator,
            AuthorizationMetrics metrics,
            ObjectProvider<BearerTokenVerifier> tokenVerifier,
            ObjectProvider<TicketAuthenticator> ticketAuthenticator,
            ObjectProvider<UserNameAuthenticator> userNameAuthenticator) {
        var validator = CredentialValidator.builder(roleMapper, properties.applicationUri())
                .validators(settings.validators())
                .certificateStore(certificateStore)
                .trustValidator(trustValidator)
                .tokenVerifier(tokenVerifier.getIfAvailable())
                .ticketAuthenticator(ticketAuthenticator.getIfAvailable())
                .userNameAuthenticator(userNameAuthenticator.getIfAvailable())
                .metrics(metrics)
                .build();
        if (tokenVerifier.getIfAvailable() == null) {
            log.warn("No BearerTokenVerifier configured: bearer tokens will be rejected");
        }
        return validator;
    }

    @Bean
    public ImpersonationContextRegistry impersonationContextRegistry(
            ObjectProvider<OsLogonService> logonService, AuthorizationMetrics metrics) {
        var registry = new ImpersonationContextRegistry(logonService.getIfAvailable(UnavailableLogonService::new));
        metrics.bindPendingImpersonations(registry);
        return registry;
    }

    @Bean
    public AuthorizationService authorizationService(
            AuthorizationSettings settings,
            CredentialValidator credentialValidator,
            ImpersonationContextRegistry impersonationContextRegistry) {
        return new AuthorizationService(settings, credentialValidator, impersonationContextRegistry);
    }

    static String hostName(AuthorizationServerProperties properties) {
        if (properties.hostName() != null && !properties.hostName().isBlank()) {
            return properties.hostName();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve the local host name, keeping 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
