package net.unishelf.service.provider;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Counts provider call outcomes in Micrometer and keeps an in-memory snapshot
 * for the admin metrics endpoint.
 */
@Component
public class ProviderCallMonitor {

    static final String METER_NAME = "unishelf.provider.calls";

    private final MeterRegistry meterRegistry;
    private final Map<String, ProviderCounters> counters = new ConcurrentHashMap<>();

    public ProviderCallMonitor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void record(String provider, ProviderCallOutcome outcome) {
        record(provider, outcome, null);
    }

    public void record(String provider, ProviderCallOutcome outcome, String failureReason) {
        Counter.builder(METER_NAME)
            .description("External provider search calls by outcome")
            .tag("provider", provider)
            .tag("outcome", outcome.tagValue())
            .register(meterRegistry)
            .increment();

        ProviderCounters providerCounters = counters.computeIfAbsent(provider, ignored -> new ProviderCounters());
        providerCounters.byOutcome.get(outcome).incrementAndGet();
        if (outcome == ProviderCallOutcome.FAILURE || outcome == ProviderCallOutcome.TIMEOUT) {
            providerCounters.lastFailureAt = Instant.now();
            providerCounters.lastFailureReason = failureReason;
        }
    }

    public long count(String provider, ProviderCallOutcome outcome) {
        ProviderCounters providerCounters = counters.get(provider);
        return providerCounters == null ? 0L : providerCounters.byOutcome.get(outcome).get();
    }

    /**
     * Point-in-time view keyed by provider name, sorted for stable output.
     */
    public Map<String, Map<String, Object>> snapshot() {
        Map<String, Map<String, Object>> result = new TreeMap<>();
        counters.forEach((provider, providerCounters) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            for (ProviderCallOutcome outcome : ProviderCallOutcome.values()) {
                entry.put(outcome.tagValue(), providerCounters.byOutcome.get(outcome).get());
            }
            entry.put("lastFailureAt", providerCounters.lastFailureAt == null ? null : providerCounters.lastFailureAt.toString());
            entry.put("lastFailureReason", providerCounters.lastFailureReason);
            result.put(provider, entry);
        });
        return result;
    }

    private static final class ProviderCounters {
        private final Map<ProviderCallOutcome, AtomicLong> byOutcome = new EnumMap<>(ProviderCallOutcome.class);
        private volatile Instant lastFailureAt;
        private volatile String lastFailureReason;

        private ProviderCounters() {
            for (ProviderCallOutcome outcome : ProviderCallOutcome.values()) {
                byOutcome.put(outcome, new AtomicLong());
            }
        }
    }
}
