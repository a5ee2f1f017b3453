package com.example.docstandards.config;

import com.example.docstandards.security.filter.IdentityHeaderFilter;
import com.example.docstandards.security.filter.RoleAuthorizationFilter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.util.matcher.PathPatternParserServerWebExchangeMatcher;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;

@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    private final RequestMappingHandlerMapping handlerMapping;

    public SecurityConfig(
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping) {
        this.handlerMapping = handlerMapping;
    }

    // API: /api/v1/** - identity headers verified upstream by the gateway
    // Filters are not beans so WebFlux does not also register them globally
    @Bean
    @Order(1)
    public SecurityWebFilterChain apiSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(new PathPatternParserServerWebExchangeMatcher("/api/v1/**"))
                .csrf(ServerHttpSecurity.CsrfSpec::disable) // No browser sessions, header auth only
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .addFilterAt(new IdentityHeaderFilter(), SecurityWebFiltersOrder.AUTHENTICATION)
                .addFilterAfter(new RoleAuthorizationFilter(handlerMapping), SecurityWebFiltersOrder.AUTHORIZATION)
                .build();
    }

    // Public: /actuator/health, /actuator/info - no auth
    @Bean
    @Order(2)
    public SecurityWebFilterChain publicSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(ServerWebExchangeMatchers.pathMatchers(
                        "/actuator/health", "/actuator/health/**", "/actuator/info"))
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
    }

    // Catch-all: deny unmatched paths
    @Bean
    @Order(Integer.MAX_VALUE)
    public SecurityWebFilterChain catchAllSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(ServerWebExchangeMatchers.anyExchange())
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().denyAll())
                .build();
    }
}
