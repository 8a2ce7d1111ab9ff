package com.finch.financeapi.infrastructure.web;

import com.finch.financeapi.config.AuthProperties;
import com.finch.security.AccessDeniedException;
import com.finch.security.AccessGuards;
import com.finch.security.AuthenticatedPrincipal;
import com.finch.security.AuthenticationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.server.PathContainer;
import org.springframework.http.server.RequestPath;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.ServletRequestPathUtils;

/**
 * Applies {@link RequireRole} and {@link RequireSelf} before the handler runs.
 *
 * <p>Method-level annotations win over type-level ones. The role check runs first. The ownership
 * check reads the same decoded path the router matched on, not the raw request URI. A missing
 * principal answers 401, a failed guard 403, both with the standard error body.
 */
@Component
public class AuthorizationInterceptor implements HandlerInterceptor {

    private final ErrorResponseWriter errorResponseWriter;
    private final boolean enforceOwnership;

    public AuthorizationInterceptor(ErrorResponseWriter errorResponseWriter, AuthProperties properties) {
        this.errorResponseWriter = errorResponseWriter;
        this.enforceOwnership = properties.enforceOwnership();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequireRole requireRole = find(method, RequireRole.class);
        RequireSelf requireSelf = find(method, RequireSelf.class);
        if (requireRole == null && requireSelf == null) {
            return true;
        }

        AuthenticatedPrincipal principal = RequestPrincipal.get(request).orElse(null);
        try {
            if (requireRole != null) {
                AccessGuards.requireRole(principal, requireRole.value());
            }
            if (requireSelf != null) {
                AccessGuards.requireSelf(principal, matchedSegments(request), enforceOwnership);
            }
            return true;
        } catch (AuthenticationException e) {
            errorResponseWriter.write(response, HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
            return false;
        } catch (AccessDeniedException e) {
            errorResponseWriter.write(response, HttpServletResponse.SC_FORBIDDEN, e.getMessage());
            return false;
        }
    }

    /**
     * Segments of the path as the handler mapping matched it: percent-decoded, with
     * {@code ;matrix} parameters removed, relative to the context path.
     */
    static List<String> matchedSegments(HttpServletRequest request) {
        RequestPath path = ServletRequestPathUtils.hasParsedRequestPath(request)
                ? ServletRequestPathUtils.getParsedRequestPath(request)
                : ServletRequestPathUtils.parseAndCache(request);
        List<String> segments = new ArrayList<>();
        segments.add("");
        for (PathContainer.Element element : path.pathWithinApplication().elements()) {
            if (element instanceof PathContainer.PathSegment segment) {
                segments.add(segment.valueToMatch());
            }
        }
        return segments;
    }

    private static <A extends Annotation> A find(HandlerMethod method, Class<A> type) {
        A annotation = method.getMethodAnnotation(type);
        return annotation != null ? annotation : method.getBeanType().getAnnotation(type);
    }
}
