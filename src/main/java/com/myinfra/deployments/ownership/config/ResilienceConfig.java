package com.myinfra.deployments.ownership.config;

import com.myinfra.deployments.ownership.catalog.HttpCatalogClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.circuitbreaker.resilience4j.ReactiveResilience4JCircuitBreakerFactory;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JConfigBuilder;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    private final AppConfig appConfig;

    /**
     * Configures the Circuit Breaker and Time Limiter guarding catalog lookups
     * from the catalog settings defined in AppConfig.
     *
     * @return Customizer for ReactiveResilience4JCircuitBreakerFactory
     */
    @Bean
    public Customizer<ReactiveResilience4JCircuitBreakerFactory> catalogCustomizer() {
        return factory -> factory.configure(builder -> {
            AppConfig.CatalogConfig catalog = appConfig.getCatalog();
            AppConfig.CircuitBreakerConfig breaker = catalog.getCircuitBreaker();

            log.debug("Configuring Circuit Breaker for '{}': failureRate={}%, wait={}s, timeout={}ms",
                    HttpCatalogClient.CIRCUIT_BREAKER_ID,
                    breaker.getFailureRateThreshold(),
                    breaker.getWaitDuration().getSeconds(),
                    catalog.getTimeLimiter().getTimeout().toMillis());

            builder.circuitBreakerConfig(CircuitBreakerConfig.custom()
                            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                            .slidingWindowSize(breaker.getSlidingWindowSize())
                            .failureRateThreshold(breaker.getFailureRateThreshold())
                            .waitDurationInOpenState(breaker.getWaitDuration())
                            .permittedNumberOfCallsInHalfOpenState(breaker.getPermittedNumberOfCallsInHalfOpenState())
                            .build())
                    .timeLimiterConfig(TimeLimiterConfig.custom()
                            .timeoutDuration(catalog.getTimeLimiter().getTimeout())
                            .build());
        }, HttpCatalogClient.CIRCUIT_BREAKER_ID);
    }
}
