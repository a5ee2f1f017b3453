package com.example.docstandards.security.filter;

import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.AuthContextHolder;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.security.exception.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static com.example.docstandards.security.filter.IdentityHeaderFilter.HEADER_ROLES;
import static com.example.docstandards.security.filter.IdentityHeaderFilter.HEADER_SUBJECT;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdentityHeaderFilter")
class IdentityHeaderFilterTest {

    private IdentityHeaderFilter filter;

    @BeforeEach
    void setUp() {
        filter = new IdentityHeaderFilter();
    }

    private static MockServerWebExchange exchange(String subject, String roles) {
        MockServerHttpRequest.BaseBuilder<?> request = MockServerHttpRequest.get("/api/v1/folders");
        if (subject != null) {
            request.header(HEADER_SUBJECT, subject);
        }
        if (roles != null) {
            request.header(HEADER_ROLES, roles);
        }
        return MockServerWebExchange.from(request);
    }

    @Nested
    @DisplayName("header validation")
    class HeaderValidation {

        @Test
        @DisplayName("should reject when X-Subject header is missing")
        void shouldRejectMissingSubject() {
            WebFilterChain chain = ex -> Mono.empty();

            StepVerifier.create(filter.filter(exchange(null, "EDITOR"), chain))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AuthenticationException.class);
                        assertThat(error.getMessage()).contains("Missing required header").contains(HEADER_SUBJECT);
                    })
                    .verify();
        }

        @Test
        @DisplayName("should reject a subject with unsafe characters")
        void shouldRejectUnsafeSubject() {
            WebFilterChain chain = ex -> Mono.empty();

            StepVerifier.create(filter.filter(exchange("editor<script>", "EDITOR"), chain))
                    .expectErrorSatisfies(error -> assertThat(error.getMessage()).contains("Invalid subject"))
                    .verify();
        }

        @Test
        @DisplayName("should reject when X-Roles header is missing")
        void shouldRejectMissingRoles() {
            WebFilterChain chain = ex -> Mono.empty();

            StepVerifier.create(filter.filter(exchange("editor-1", null), chain))
                    .expectErrorSatisfies(error -> assertThat(error.getMessage()).contains(HEADER_ROLES))
                    .verify();
        }

        @Test
        @DisplayName("should reject unknown roles")
        void shouldRejectUnknownRole() {
            WebFilterChain chain = ex -> Mono.empty();

            StepVerifier.create(filter.filter(exchange("editor-1", "EDITOR,SUPERUSER"), chain))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AuthenticationException.class);
                        assertThat(error.getMessage()).contains("Invalid role");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should reject a roles header with no roles")
        void shouldRejectEmptyRoleList() {
            WebFilterChain chain = ex -> Mono.empty();

            StepVerifier.create(filter.filter(exchange("editor-1", " , "), chain))
                    .expectErrorSatisfies(error -> assertThat(error.getMessage()).contains("No roles"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("successful authentication")
    class SuccessfulAuthentication {

        @Test
        @DisplayName("should expose the AuthContext to downstream handlers")
        void shouldPopulateAuthContext() {
            AtomicReference<AuthContext> captured = new AtomicReference<>();
            WebFilterChain chain = ex -> AuthContextHolder.getContext()
                    .doOnNext(captured::set)
                    .then();

            StepVerifier.create(filter.filter(exchange("admin-1", "viewer, standards-admin"), chain))
                    .verifyComplete();

            assertThat(captured.get()).isNotNull();
            assertThat(captured.get().subject()).isEqualTo("admin-1");
            assertThat(captured.get().roles()).containsExactlyInAnyOrder(Role.VIEWER, Role.STANDARDS_ADMIN);
        }
    }
}
