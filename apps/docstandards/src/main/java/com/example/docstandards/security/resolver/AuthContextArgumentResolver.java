package com.example.docstandards.security.resolver;

import com.example.docstandards.security.annotation.ResolvedAuth;
import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.AuthContextHolder;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Resolves {@link ResolvedAuth} parameters from the reactive context populated by the
 * identity filter. A missing context surfaces as an authentication error, never as a null
 * argument.
 */
@Component
public class AuthContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        if (!parameter.hasParameterAnnotation(ResolvedAuth.class)) {
            return false;
        }
        Class<?> type = parameter.getParameterType();
        return type.equals(AuthContext.class) || type.equals(String.class);
    }

    @Override
    public Mono<Object> resolveArgument(
            MethodParameter parameter,
            BindingContext bindingContext,
            ServerWebExchange exchange) {
        if (parameter.getParameterType().equals(String.class)) {
            return AuthContextHolder.getContext().map(AuthContext::subject);
        }
        return AuthContextHolder.getContext().cast(Object.class);
    }
}
