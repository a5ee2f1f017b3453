package com.example.docstandards.security.resolver;

import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.AuthContextHolder;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.security.exception.AuthenticationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.reactive.BindingContext;
import reactor.test.StepVerifier;

import java.lang.reflect.Method;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AuthContextArgumentResolverTest {

    private final AuthContextArgumentResolver resolver = new AuthContextArgumentResolver();
    private final MockServerWebExchange exchange =
            MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/jobs/job-1/retry"));
    private final AuthContext admin = AuthContext.of("alice", Set.of(Role.STANDARDS_ADMIN));

    @SuppressWarnings("unused")
    static class TestController {
        public void context(@ResolvedAuth AuthContext auth) {}
        public void subject(@ResolvedAuth String actor) {}
        public void unannotated(AuthContext auth) {}
        public void wrongType(@ResolvedAuth Integer count) {}
    }

    private static MethodParameter parameterOf(String methodName) throws NoSuchMethodException {
        for (Method method : TestController.class.getMethods()) {
            if (method.getName().equals(methodName)) {
                return new MethodParameter(method, 0);
            }
        }
        throw new NoSuchMethodException(methodName);
    }

    @Nested
    @DisplayName("supportsParameter")
    class Supports {

        @Test
        @DisplayName("accepts annotated AuthContext and String parameters")
        void acceptsSupportedTypes() throws Exception {
            assertThat(resolver.supportsParameter(parameterOf("context"))).isTrue();
            assertThat(resolver.supportsParameter(parameterOf("subject"))).isTrue();
        }

        @Test
        @DisplayName("ignores unannotated or unsupported parameters")
        void ignoresOthers() throws Exception {
            assertThat(resolver.supportsParameter(parameterOf("unannotated"))).isFalse();
            assertThat(resolver.supportsParameter(parameterOf("wrongType"))).isFalse();
        }
    }

    @Nested
    @DisplayName("resolveArgument")
    class Resolve {

        @Test
        @DisplayName("resolves the full context")
        void resolvesContext() throws Exception {
            StepVerifier.create(resolver.resolveArgument(parameterOf("context"), new BindingContext(), exchange)
                            .contextWrite(AuthContextHolder.withContext(admin)))
                    .expectNext(admin)
                    .verifyComplete();
        }

        @Test
        @DisplayName("resolves only the subject for String parameters")
        void resolvesSubject() throws Exception {
            StepVerifier.create(resolver.resolveArgument(parameterOf("subject"), new BindingContext(), exchange)
                            .contextWrite(AuthContextHolder.withContext(admin)))
                    .expectNext("alice")
                    .verifyComplete();
        }

        @Test
        @DisplayName("fails with an authentication error when no context is present")
        void failsWithoutContext() throws Exception {
            StepVerifier.create(resolver.resolveArgument(parameterOf("subject"), new BindingContext(), exchange))
                    .expectError(AuthenticationException.class)
                    .verify();
        }
    }
}
