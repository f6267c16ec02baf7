package net.unishelf.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breaker and rate limiter registries shared by all provider adapters.
 * Each adapter takes its own named instance, so one failing provider never
 * opens another provider's circuit.
 */
@Slf4j
@Configuration
public class ProviderResilienceConfig {

    @Bean
    public CircuitBreakerRegistry providerCircuitBreakerRegistry(
            @Value("${app.providers.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.providers.circuit-breaker.wait-duration-open:30s}") Duration waitDurationOpen,
            @Value("${app.providers.circuit-breaker.sliding-window-size:20}") int slidingWindowSize) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(failureRateThreshold)
            .waitDurationInOpenState(waitDurationOpen)
            .slidingWindowSize(slidingWindowSize)
            .minimumNumberOfCalls(Math.min(slidingWindowSize, 10))
            .permittedNumberOfCallsInHalfOpenState(2)
            .build();
        log.info("Provider circuit breakers: failureRateThreshold={}%, waitDurationOpen={}, window={}",
            failureRateThreshold, waitDurationOpen, slidingWindowSize);
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RateLimiterRegistry providerRateLimiterRegistry(
            @Value("${app.providers.rate-limit.per-second:5}") int permitsPerSecond) {
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .limitForPeriod(permitsPerSecond)
            .timeoutDuration(Duration.ZERO)
            .build();
        log.info("Provider rate limiters: {} request(s)/second per provider", permitsPerSecond);
        return RateLimiterRegistry.of(config);
    }
}
