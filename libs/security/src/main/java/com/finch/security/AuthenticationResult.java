package com.finch.security;

/**
 * Outcome of running the {@link Authenticator} over one request.
 *
 * @param outcome   terminal state reached
 * @param principal verified identity, present only when {@code outcome} is AUTHENTICATED
 */
public record AuthenticationResult(Outcome outcome, AuthenticatedPrincipal principal) {

    public enum Outcome {
        /** Route is allow-listed; continue without identity. */
        BYPASSED,
        /** Token verified; continue with {@link #principal()}. */
        AUTHENTICATED,
        /** Missing, malformed or invalid token; answer 401. */
        REJECTED
    }

    public static AuthenticationResult bypassed() {
        return new AuthenticationResult(Outcome.BYPASSED, null);
    }

    public static AuthenticationResult authenticated(AuthenticatedPrincipal principal) {
        return new AuthenticationResult(Outcome.AUTHENTICATED, principal);
    }

    public static AuthenticationResult rejected() {
        return new AuthenticationResult(Outcome.REJECTED, null);
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }
}
