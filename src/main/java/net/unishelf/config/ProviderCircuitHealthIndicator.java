package net.unishelf.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import net.unishelf.service.provider.ExternalProviderAdapter;
import net.unishelf.service.provider.ExternalProviderRegistry;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports each provider's circuit state. Open circuits degrade search but never
 * take the service down, so the indicator stays UP and lists them in details.
 */
@Component("providerCircuits")
public class ProviderCircuitHealthIndicator implements HealthIndicator {

    private final ExternalProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public ProviderCircuitHealthIndicator(ExternalProviderRegistry providerRegistry,
                                          CircuitBreakerRegistry circuitBreakerRegistry) {
        this.providerRegistry = providerRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        int open = 0;
        for (ExternalProviderAdapter adapter : providerRegistry.all()) {
            if (!adapter.isEnabled()) {
                details.put(adapter.name(), "DISABLED");
                continue;
            }
            CircuitBreaker.State state = circuitBreakerRegistry.circuitBreaker(adapter.name()).getState();
            if (state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN) {
                open++;
            }
            details.put(adapter.name(), state.name());
        }
        details.put("openCircuits", open);
        return Health.up().withDetails(details).build();
    }
}
