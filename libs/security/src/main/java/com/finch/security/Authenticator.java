package com.finch.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-request authentication, independent of any web framework.
 *
 * <p>Moves a request from unauthenticated to one of three terminal states:
 *
 * <ol>
 *   <li>allow-listed route: {@link AuthenticationResult.Outcome#BYPASSED}
 *   <li>bearer token missing, malformed or failing validation:
 *       {@link AuthenticationResult.Outcome#REJECTED}
 *   <li>otherwise {@link AuthenticationResult.Outcome#AUTHENTICATED} with the subject, email and
 *       the role from the {@link RoleResolver}
 * </ol>
 *
 * <p>Extraction and validation failures are indistinguishable in the result.
 */
public final class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final TokenService tokenService;
    private final AuthenticationBypass bypass;
    private final RoleResolver roleResolver;

    public Authenticator(TokenService tokenService, AuthenticationBypass bypass, RoleResolver roleResolver) {
        this.tokenService = Objects.requireNonNull(tokenService, "tokenService must not be null");
        this.bypass = Objects.requireNonNull(bypass, "bypass must not be null");
        this.roleResolver = Objects.requireNonNull(roleResolver, "roleResolver must not be null");
    }

    /**
     * @param path                request path without query string
     * @param method              HTTP method, upper case
     * @param authorizationHeader raw Authorization header value, may be null
     */
    public AuthenticationResult authenticate(String path, String method, String authorizationHeader) {
        if (bypass.matches(path, method)) {
            return AuthenticationResult.bypassed();
        }

        Optional<String> token = BearerTokenExtractor.extract(authorizationHeader);
        if (token.isEmpty()) {
            log.warn("Rejected {} {}: missing or malformed Authorization header", method, path);
            return AuthenticationResult.rejected();
        }

        IdentityClaims claims;
        try {
            claims = tokenService.validate(token.get());
        } catch (AuthenticationException e) {
            log.warn("Rejected {} {}: bearer token failed validation", method, path);
            return AuthenticationResult.rejected();
        }

        Role role = Objects.requireNonNull(roleResolver.resolve(claims),
                () -> "RoleResolver returned no role for subject " + claims.subjectId());
        var principal = new AuthenticatedPrincipal(claims.subjectId(), claims.email(), role);
        log.debug("Authenticated subject={} role={}", principal.subjectId(), role.value());
        return AuthenticationResult.authenticated(principal);
    }
}
