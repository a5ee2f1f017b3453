package com.example.docstandards.security.filter;

import com.example.docstandards.common.util.StringSanitizer;
import com.example.docstandards.security.context.AuthContext;
import com.example.docstandards.security.context.AuthContextHolder;
import com.example.docstandards.security.context.Role;
import com.example.docstandards.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.Set;

/**
 * Builds the {@link AuthContext} from identity headers set by the gateway after it has
 * verified the caller with the identity provider. The service trusts these headers and
 * must only be reachable through that gateway.
 */
@Slf4j
public class IdentityHeaderFilter implements WebFilter, Ordered {

    static final String HEADER_SUBJECT = "X-Subject";
    static final String HEADER_ROLES = "X-Roles";

    @Override
    public int getOrder() {
        return -100; // Run early in the filter chain
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();

        String subjectHeader = StringSanitizer.headerValue(request.getHeaders().getFirst(HEADER_SUBJECT));
        String rolesHeader = StringSanitizer.headerValue(request.getHeaders().getFirst(HEADER_ROLES));

        if (subjectHeader == null || subjectHeader.isBlank()) {
            return Mono.error(new AuthenticationException("Missing required header: " + HEADER_SUBJECT));
        }
        if (!StringSanitizer.isValidSafeId(subjectHeader)) {
            return Mono.error(new AuthenticationException("Invalid subject: " + StringSanitizer.forLog(subjectHeader)));
        }
        if (rolesHeader == null || rolesHeader.isBlank()) {
            return Mono.error(new AuthenticationException("Missing required header: " + HEADER_ROLES));
        }

        Set<Role> roles = EnumSet.noneOf(Role.class);
        for (String raw : rolesHeader.split(",")) {
            String value = raw.trim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                roles.add(Role.valueOf(value.toUpperCase().replace("-", "_")));
            } catch (IllegalArgumentException e) {
                return Mono.error(new AuthenticationException("Invalid role: " + StringSanitizer.forLog(value)));
            }
        }
        if (roles.isEmpty()) {
            return Mono.error(new AuthenticationException("No roles in header: " + HEADER_ROLES));
        }

        AuthContext authContext = AuthContext.of(subjectHeader, roles);
        log.debug("Subject authenticated: subject={}, roles={}", subjectHeader, roles);

        return chain.filter(exchange)
                .contextWrite(AuthContextHolder.withContext(authContext));
    }
}
