package com.finch.financeapi;

import com.finch.financeapi.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Finch finance API.
 *
 * <p>Every request passes through, in order:
 *
 * <ol>
 *   <li>{@code CorrelationIdFilter}: correlation id in MDC and response header
 *   <li>{@code BearerAuthenticationFilter}: allow-list check, bearer token validation, principal
 *       attached to the request
 *   <li>{@code AuthorizationInterceptor}: {@code @RequireRole} / {@code @RequireSelf} guards
 *   <li>the controller
 * </ol>
 *
 * <p>Startup fails when {@code finch.auth.jwt-secret} is missing or shorter than 32 bytes.
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthProperties.class)
public class FinanceApiApplication {

    private static final Logger log = LoggerFactory.getLogger(FinanceApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FinanceApiApplication.class, args);
        log.info("Finch finance API started successfully");
    }
}
