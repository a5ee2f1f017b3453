package com.example.docstandards.config;

import com.example.docstandards.security.resolver.AuthContextArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * Registers the {@link AuthContextArgumentResolver} so controllers can take the caller,
 * or only the caller's subject, as a {@code @ResolvedAuth} parameter.
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final AuthContextArgumentResolver authContextArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(authContextArgumentResolver);
    }
}
