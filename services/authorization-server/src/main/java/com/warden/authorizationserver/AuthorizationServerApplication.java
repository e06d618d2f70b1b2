package com.warden.authorizationserver;

import com.warden.authorizationserver.config.AuthorizationServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Hosts the Warden authorization components.
 *
 * <p>The protocol server embeds {@link com.warden.security.AuthorizationService} and calls its
 * hooks; this application wires that service from {@code warden.authorization.*} and exposes
 * its effective configuration and health over HTTP:
 *
 * <ul>
 *   <li>{@code GET /api/v1/policies} lists active and skipped user token policies
 *   <li>{@code /actuator/health} reports whether any policy survived startup
 *   <li>{@code /actuator/metrics} carries the credential counters
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthorizationServerProperties.class)
public class AuthorizationServerApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthorizationServerApplication.class, args);
        log.info("Warden authorization server started");
    }
}
