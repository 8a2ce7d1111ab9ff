package com.finch.financeapi.infrastructure.web;

import com.finch.security.AuthenticatedPrincipal;
import jakarta.servlet.ServletRequest;
import java.util.Optional;

/** Stores the authenticated principal as a request attribute, scoped to one request. */
public final class RequestPrincipal {

    public static final String ATTRIBUTE = RequestPrincipal.class.getName() + ".PRINCIPAL";

    private RequestPrincipal() {
        // utility class
    }

    public static void set(ServletRequest request, AuthenticatedPrincipal principal) {
        request.setAttribute(ATTRIBUTE, principal);
    }

    /** Empty for allow-listed routes, which run without a principal. */
    public static Optional<AuthenticatedPrincipal> get(ServletRequest request) {
        return Optional.ofNullable((AuthenticatedPrincipal) request.getAttribute(ATTRIBUTE));
    }
}
