package com.finch.financeapi.config;

import com.finch.security.AuthenticationBypass;
import com.finch.security.Authenticator;
import com.finch.security.PasswordHasher;
import com.finch.security.Role;
import com.finch.security.RoleResolver;
import com.finch.security.TokenService;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-neutral security components from {@link AuthProperties}.
 *
 * <p>{@link RoleResolver} and {@link Clock} back off when the application defines its own, which
 * is how real role data gets plugged in.
 */
@Configuration
public class SecurityConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenService tokenService(AuthProperties properties, Clock clock) {
        return new TokenService(properties.jwtSecret(), clock);
    }

    @Bean
    public PasswordHasher passwordHasher(AuthProperties properties) {
        return new PasswordHasher(properties.passwordHashCost());
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleResolver roleResolver() {
        return RoleResolver.fixed(Role.USER);
    }

    @Bean
    public Authenticator authenticator(TokenService tokenService, RoleResolver roleResolver) {
        return new Authenticator(tokenService, AuthenticationBypass.defaults(), roleResolver);
    }
}
