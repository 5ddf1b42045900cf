package com.myinfra.deployments.ownership.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
public class AppConfig {

    @Valid
    private OwnershipConfig ownership = new OwnershipConfig();

    @Valid
    private CatalogConfig catalog = new CatalogConfig();

    private AuthConfig auth = new AuthConfig();

    @Data
    public static class OwnershipConfig {
        private boolean cacheEnabled = true;

        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(5);

        @Positive
        private long cacheMaxSize = 10_000;

        private boolean enrichmentEnabled = true;

        @NotNull
        private Duration enrichmentTimeout = Duration.ofSeconds(2);

        @Positive
        private int enrichmentConcurrency = 8;

        private List<String> integrationAnnotations = new ArrayList<>(List.of("github.com/project-slug"));
    }

    @Data
    public static class CatalogConfig {
        private String baseUrl;
        private String token;

        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
        private TimeLimiterConfig timeLimiter = new TimeLimiterConfig();
    }

    @Data
    public static class AuthConfig {
        private String jwtSecret;
        private String jwtPublicKey;
        private String jwtCookie;
    }

    @Data
    public static class CircuitBreakerConfig {
        private float failureRateThreshold = 50.0f;
        private Duration waitDuration = Duration.ofSeconds(10);
        private int slidingWindowSize = 10;
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class TimeLimiterConfig {
        private Duration timeout = Duration.ofSeconds(5);
    }
}
