package com.finch.financeapi.infrastructure.web;

import com.finch.security.AuthenticationException;
import com.finch.security.AuthenticationResult;
import com.finch.security.Authenticator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates every request that is not on the allow-list.
 *
 * <p>Delegates the decision to {@link Authenticator}. Rejected requests get a 401 JSON body and
 * never reach a handler. Authenticated requests carry their principal as a request attribute (see
 * {@link RequestPrincipal}) and the subject id in the MDC under {@code userId}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class BearerAuthenticationFilter extends OncePerRequestFilter {

    public static final String MDC_KEY = "userId";

    private final Authenticator authenticator;
    private final ErrorResponseWriter errorResponseWriter;

    public BearerAuthenticationFilter(Authenticator authenticator, ErrorResponseWriter errorResponseWriter) {
        this.authenticator = authenticator;
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        AuthenticationResult result = authenticator.authenticate(
                pathOf(request), request.getMethod(), request.getHeader(HttpHeaders.AUTHORIZATION));

        if (result.isRejected()) {
            errorResponseWriter.write(
                    response, HttpServletResponse.SC_UNAUTHORIZED, AuthenticationException.DEFAULT_MESSAGE);
            return;
        }
        if (result.principal() == null) {
            filterChain.doFilter(request, response);
            return;
        }

        RequestPrincipal.set(request, result.principal());
        MDC.put(MDC_KEY, result.principal().subjectId().toString());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
