package com.finch.security;

/**
 * Decides which role an authenticated subject holds.
 *
 * <p>Tokens carry no role, so the role comes from whatever the integrator wires in here. The
 * default, {@link #fixed(Role) fixed(USER)}, gives every caller {@link Role#USER}; with it, admin
 * guards always deny.
 */
@FunctionalInterface
public interface RoleResolver {

    /**
     * @return the subject's role, never null; {@link Authenticator} fails the request with a
     *     {@link NullPointerException} otherwise
     */
    Role resolve(IdentityClaims claims);

    /** A resolver that assigns the same role to everyone. */
    static RoleResolver fixed(Role role) {
        return claims -> role;
    }
}
