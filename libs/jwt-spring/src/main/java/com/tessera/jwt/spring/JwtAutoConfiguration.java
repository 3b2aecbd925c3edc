package com.tessera.jwt.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;

/**
 * Spring Boot auto-configuration for token issuance and verification.
 *
 * <p>Active only when {@code tessera.jwt.secret} is set (to any value), so adding the module to the classpath
 * alone never creates a service with no key. Metrics go to the application's {@link MeterRegistry}
 * if one exists; otherwise to an empty composite registry, which records nothing.
 */
@AutoConfiguration
@Conditional(OnJwtSecretCondition.class)
@EnableConfigurationProperties(JwtProperties.class)
public class JwtAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TokenMetrics tokenMetrics(ObjectProvider<MeterRegistry> registry) {
        return new TokenMetrics(registry.getIfAvailable(CompositeMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public JwtTokenService jwtTokenService(JwtProperties properties, TokenMetrics metrics) {
        return new JwtTokenService(properties, metrics);
    }
}
