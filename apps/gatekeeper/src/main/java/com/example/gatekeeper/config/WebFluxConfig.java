package com.example.gatekeeper.config;

import com.example.gatekeeper.auth.resolver.AuthPrincipalArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

import java.time.Clock;

/**
 * WebFlux configuration for custom argument resolvers and the shared clock.
 *
 * <p>Registers the {@link AuthPrincipalArgumentResolver} to enable injection of
 * {@link com.example.gatekeeper.auth.context.AuthenticatedPrincipal} into controller methods.</p>
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final AuthPrincipalArgumentResolver authPrincipalArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(authPrincipalArgumentResolver);
    }

    /**
     * Clock for token expiry, session windows and audit timestamps. Tests substitute a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
