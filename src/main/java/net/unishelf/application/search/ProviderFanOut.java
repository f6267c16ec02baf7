package net.unishelf.application.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.config.ResourceSearchProperties;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.service.provider.ExternalProviderAdapter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs the selected provider adapters concurrently and waits for every one of them.
 *
 * <p>Each call is isolated: an error, an empty completion or a timeout becomes an
 * empty list for that provider and never reaches its siblings. The returned map
 * holds one entry per adapter, in selection order.</p>
 */
@Slf4j
@Component
public class ProviderFanOut {

    // Adapters enforce their own timeout; this outer bound catches ones that do not
    private static final Duration ISOLATION_GRACE = Duration.ofMillis(500);

    private final Duration isolationTimeout;

    @Autowired
    public ProviderFanOut(ResourceSearchProperties searchProperties) {
        this(searchProperties.getProviderTimeout().plus(ISOLATION_GRACE));
    }

    ProviderFanOut(Duration isolationTimeout) {
        this.isolationTimeout = isolationTimeout;
    }

    public Mono<Map<String, List<CandidateRecord>>> searchAll(List<ExternalProviderAdapter> adapters,
                                                             String query,
                                                             int maxResults) {
        if (adapters.isEmpty()) {
            return Mono.just(Map.of());
        }

        List<Mono<Map.Entry<String, List<CandidateRecord>>>> calls = new ArrayList<>(adapters.size());
        for (ExternalProviderAdapter adapter : adapters) {
            calls.add(isolated(adapter, query, maxResults));
        }

        return Flux.merge(calls)
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .map(settled -> {
                Map<String, List<CandidateRecord>> ordered = new LinkedHashMap<>();
                for (ExternalProviderAdapter adapter : adapters) {
                    ordered.put(adapter.name(), settled.getOrDefault(adapter.name(), List.of()));
                }
                return ordered;
            });
    }

    private Mono<Map.Entry<String, List<CandidateRecord>>> isolated(ExternalProviderAdapter adapter,
                                                                    String query,
                                                                    int maxResults) {
        return Mono.defer(() -> adapter.search(query, maxResults))
            .timeout(isolationTimeout)
            .defaultIfEmpty(List.of())
            .onErrorResume(ex -> {
                log.warn("Provider '{}' failed during fan-out for query '{}': {}",
                    adapter.name(), query, ex.toString());
                return Mono.just(List.of());
            })
            .map(candidates -> Map.entry(adapter.name(), candidates));
    }
}
