package com.finch.financeapi.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finch.financeapi.config.AuthProperties;
import com.finch.security.AuthenticatedPrincipal;
import com.finch.security.Role;
import com.finch.security.testing.TestTokens;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

@DisplayName("AuthorizationInterceptor")
class AuthorizationInterceptorTest {

    private static final String SECRET = TestTokens.SECRET;

    private final MockHttpServletResponse response = new MockHttpServletResponse();

    private static AuthorizationInterceptor interceptor(boolean enforceOwnership) {
        return new AuthorizationInterceptor(
                new ErrorResponseWriter(new ObjectMapper()), new AuthProperties(SECRET, 4, enforceOwnership));
    }

    private static HandlerMethod handler(Object bean, String method) throws NoSuchMethodException {
        return new HandlerMethod(bean, bean.getClass().getMethod(method));
    }

    private static MockHttpServletRequest request(String path, AuthenticatedPrincipal principal) {
        var request = new MockHttpServletRequest("GET", path);
        if (principal != null) {
            RequestPrincipal.set(request, principal);
        }
        return request;
    }

    static String percentEncodeFirst(String value) {
        return "%%%02X".formatted((int) value.charAt(0)) + value.substring(1);
    }

    static class UserHandlers {
        @RequireSelf
        public void own() {}

        public void open() {}
    }

    @RequireRole(Role.ADMIN)
    static class AdminHandlers {
        public void list() {}
    }

    @Nested
    @DisplayName("@RequireRole")
    class RoleGuard {

        @Test
        @DisplayName("passes a principal holding the role declared on the controller")
        void passesAdmin() throws Exception {
            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/admin/users", TestTokens.principal(Role.ADMIN)),
                    response, handler(new AdminHandlers(), "list"));

            assertThat(proceed).isTrue();
        }

        @Test
        @DisplayName("answers 403 'Insufficient permissions' for any other role")
        void deniesUser() throws Exception {
            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/admin/users", TestTokens.principal(Role.USER)),
                    response, handler(new AdminHandlers(), "list"));

            assertThat(proceed).isFalse();
            assertThat(response.getStatus()).isEqualTo(403);
            assertThat(response.getContentAsString()).contains("Insufficient permissions");
        }

        @Test
        @DisplayName("answers 401 when no principal is attached")
        void noPrincipal() throws Exception {
            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/admin/users", null), response, handler(new AdminHandlers(), "list"));

            assertThat(proceed).isFalse();
            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentAsString()).contains("User role not found in context");
        }
    }

    @Nested
    @DisplayName("@RequireSelf")
    class SelfGuard {

        @Test
        @DisplayName("passes when the path names the caller")
        void passesOwnPath() throws Exception {
            var principal = TestTokens.principal();

            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/users/" + principal.subjectId(), principal),
                    response, handler(new UserHandlers(), "own"));

            assertThat(proceed).isTrue();
        }

        @Test
        @DisplayName("answers 403 when the path names another user")
        void deniesOtherUser() throws Exception {
            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/users/" + UUID.randomUUID(), TestTokens.principal()),
                    response, handler(new UserHandlers(), "own"));

            assertThat(proceed).isFalse();
            assertThat(response.getStatus()).isEqualTo(403);
            assertThat(response.getContentAsString()).contains("Cannot access another user's resources");
        }

        @Test
        @DisplayName("reads the user id past matrix parameters on the users segment")
        void matrixParameters() throws Exception {
            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/users;x=1/" + UUID.randomUUID(), TestTokens.principal()),
                    response, handler(new UserHandlers(), "own"));

            assertThat(proceed).isFalse();
            assertThat(response.getStatus()).isEqualTo(403);
        }

        @Test
        @DisplayName("decodes a percent-encoded user id before comparing")
        void percentEncodedOwnId() throws Exception {
            var principal = TestTokens.principal();

            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/users/" + percentEncodeFirst(principal.subjectId().toString()), principal),
                    response, handler(new UserHandlers(), "own"));

            assertThat(proceed).isTrue();
        }

        @Test
        @DisplayName("passes a path without a user segment unless ownership is enforced")
        void pathWithoutUser() throws Exception {
            var handler = handler(new UserHandlers(), "own");

            assertThat(interceptor(false).preHandle(
                    request("/api/v1/accounts", TestTokens.principal()), response, handler)).isTrue();
            assertThat(interceptor(true).preHandle(
                    request("/api/v1/accounts", TestTokens.principal()), response, handler)).isFalse();
            assertThat(response.getStatus()).isEqualTo(403);
        }

        @Test
        @DisplayName("answers 401 when no principal is attached")
        void noPrincipal() throws Exception {
            boolean proceed = interceptor(false).preHandle(
                    request("/api/v1/users/" + UUID.randomUUID(), null),
                    response, handler(new UserHandlers(), "own"));

            assertThat(proceed).isFalse();
            assertThat(response.getStatus()).isEqualTo(401);
        }
    }

    @Test
    @DisplayName("ignores handlers without guard annotations")
    void unannotated() throws Exception {
        assertThat(interceptor(true).preHandle(
                request("/api/v1/users/me", null), response, handler(new UserHandlers(), "open"))).isTrue();
    }

    @Test
    @DisplayName("ignores non-controller handlers such as static resources")
    void nonHandlerMethod() throws Exception {
        assertThat(interceptor(true).preHandle(request("/favicon.ico", null), response, new Object())).isTrue();
    }
}
