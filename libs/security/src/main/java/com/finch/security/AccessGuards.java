package com.finch.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Authorization checks applied after authentication.
 *
 * <p>Both guards expect the principal produced by {@link Authenticator}; a {@code null}
 * principal means authentication never ran for the route and is treated as unauthenticated.
 */
public final class AccessGuards {

    static final String USERS_SEGMENT = "users";

    private static final Logger log = LoggerFactory.getLogger(AccessGuards.class);

    private AccessGuards() {
        // utility class
    }

    /**
     * Requires the caller to hold exactly {@code required}.
     *
     * @throws AuthenticationException if there is no principal
     * @throws AccessDeniedException   if the principal's role differs
     */
    public static void requireRole(AuthenticatedPrincipal principal, Role required) {
        if (principal == null) {
            throw new AuthenticationException("User role not found in context");
        }
        if (principal.role() != required) {
            log.warn("Access denied: subject={} role={} requiredRole={}",
                    principal.subjectId(), principal.role().value(), required.value());
            throw new AccessDeniedException("Insufficient permissions");
        }
    }

    public static void requireAdmin(AuthenticatedPrincipal principal) {
        requireRole(principal, Role.ADMIN);
    }

    /**
     * Requires that a path of the form {@code .../users/{id}/...} names the caller.
     *
     * <p>The segment after the first {@code users} segment is compared with the subject id as a
     * string. A path without a {@code users} segment followed by another segment passes unless
     * {@code enforceOwnership} is set.
     *
     * @throws AuthenticationException if there is no principal
     * @throws AccessDeniedException   if the path names another user, or names none while
     *     ownership is enforced
     */
    public static void requireSelf(AuthenticatedPrincipal principal, String path, boolean enforceOwnership) {
        List<String> segments = path == null ? List.of() : Arrays.asList(path.split("/", -1));
        requireSelf(principal, segments, enforceOwnership);
    }

    /**
     * Same check over path segments that are already decoded, for callers whose router matched
     * on something other than the raw path string. A decoded segment may itself contain {@code /}.
     */
    public static void requireSelf(AuthenticatedPrincipal principal, List<String> segments, boolean enforceOwnership) {
        if (principal == null) {
            throw new AuthenticationException("User ID not found in context");
        }
        String subject = principal.subjectId().toString();
        for (int i = 0; i < segments.size() - 1; i++) {
            if (USERS_SEGMENT.equals(segments.get(i))) {
                String requested = segments.get(i + 1);
                if (!requested.equals(subject)) {
                    log.warn("Access denied: subject={} requestedUser={}", subject, requested);
                    throw new AccessDeniedException("Cannot access another user's resources");
                }
                return;
            }
        }
        if (enforceOwnership) {
            log.warn("Access denied: subject={} path={} names no user", subject, String.join("/", segments));
            throw new AccessDeniedException("Cannot access another user's resources");
        }
    }
}
