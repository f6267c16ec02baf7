package net.unishelf.service.provider;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.time.Duration;
import net.unishelf.config.ResourceSearchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Shared collaborators every provider adapter needs around its network call:
 * per-provider circuit breaker and rate limiter, the outcome monitor, and the
 * per-call timeout.
 */
@Component
public class ProviderCallSupport {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final ProviderCallMonitor monitor;
    private final Duration providerTimeout;

    @Autowired
    public ProviderCallSupport(CircuitBreakerRegistry circuitBreakerRegistry,
                               RateLimiterRegistry rateLimiterRegistry,
                               ProviderCallMonitor monitor,
                               ResourceSearchProperties searchProperties) {
        this(circuitBreakerRegistry, rateLimiterRegistry, monitor, searchProperties.getProviderTimeout());
    }

    public ProviderCallSupport(CircuitBreakerRegistry circuitBreakerRegistry,
                               RateLimiterRegistry rateLimiterRegistry,
                               ProviderCallMonitor monitor,
                               Duration providerTimeout) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.monitor = monitor;
        this.providerTimeout = providerTimeout;
    }

    CircuitBreaker circuitBreaker(String provider) {
        return circuitBreakerRegistry.circuitBreaker(provider);
    }

    RateLimiter rateLimiter(String provider) {
        return rateLimiterRegistry.rateLimiter(provider);
    }

    ProviderCallMonitor monitor() {
        return monitor;
    }

    Duration providerTimeout() {
        return providerTimeout;
    }
}
