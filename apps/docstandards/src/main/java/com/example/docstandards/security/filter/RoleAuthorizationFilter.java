package com.example.docstandards.security.filter;

import com.example.docstandards.security.annotation.RequiredRole;
import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.AuthContextHolder;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.security.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

@Slf4j
public class RoleAuthorizationFilter implements WebFilter, Ordered {

    private final RequestMappingHandlerMapping handlerMapping;

    public RoleAuthorizationFilter(RequestMappingHandlerMapping handlerMapping) {
        this.handlerMapping = handlerMapping;
    }

    @Override
    public int getOrder() {
        return 0; // After authentication
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        // No handler or no @RequiredRole = any authenticated subject
        return handlerMapping.getHandler(exchange)
                .filter(handler -> handler instanceof HandlerMethod)
                .cast(HandlerMethod.class)
                .mapNotNull(this::findAnnotation)
                .flatMap(annotation -> AuthContextHolder.getContext()
                        .onErrorMap(e -> !(e instanceof AuthorizationException),
                                e -> new AuthorizationException("Authorization check failed", e))
                        .flatMap(ctx -> checkRoles(ctx, annotation, exchange)))
                .then(Mono.defer(() -> chain.filter(exchange)));
    }

    private Mono<AuthContext> checkRoles(AuthContext ctx, RequiredRole annotation, ServerWebExchange exchange) {
        Set<Role> requiredRoles = EnumSet.noneOf(Role.class);
        requiredRoles.addAll(Arrays.asList(annotation.value()));

        if (!ctx.hasAnyRole(requiredRoles)) {
            log.warn("Subject {} with roles {} not authorized for {}. Required: {}",
                    ctx.subject(), ctx.roles(), exchange.getRequest().getPath(), requiredRoles);
            return Mono.error(new AuthorizationException(
                    "Subject " + ctx.subject() + " lacks required roles " + requiredRoles));
        }

        log.debug("Role authorization passed: subject={}, endpoint={}",
                ctx.subject(), exchange.getRequest().getPath());
        return Mono.just(ctx);
    }

    private RequiredRole findAnnotation(HandlerMethod method) {
        RequiredRole annotation = method.getMethodAnnotation(RequiredRole.class);
        if (annotation != null) {
            return annotation;
        }

        // Fall back to class level
        return AnnotatedElementUtils.findMergedAnnotation(
                method.getBeanType(), RequiredRole.class);
    }
}
