package net.unishelf.application.search;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.unishelf.adapters.persistence.ResourceRepository;
import net.unishelf.config.ResourceSearchProperties;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ResourceFilter;
import net.unishelf.domain.resource.ResourcePage;
import net.unishelf.domain.resource.ResourceType;
import net.unishelf.exception.InvalidSearchRequestException;
import net.unishelf.exception.SearchTimeoutException;
import net.unishelf.util.ExternalApiLogger;
import net.unishelf.util.SearchQueryUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Answers a resource search by querying the local store and the selected
 * external providers concurrently, then joining all of them into one envelope.
 *
 * <p>The join waits for every source to settle. Provider failures are absorbed
 * per provider; a local store failure or the request deadline fails the whole
 * search. Cancelling the returned {@link Mono} cancels in-flight provider calls.</p>
 */
@Slf4j
@Service
public class ResourceSearchUseCase {

    private final ResourceRepository resourceRepository;
    private final SourceSelector sourceSelector;
    private final ProviderFanOut providerFanOut;
    private final SearchResultAggregator aggregator;
    private final ResourceSearchProperties searchProperties;

    public ResourceSearchUseCase(ResourceRepository resourceRepository,
                                 SourceSelector sourceSelector,
                                 ProviderFanOut providerFanOut,
                                 SearchResultAggregator aggregator,
                                 ResourceSearchProperties searchProperties) {
        this.resourceRepository = resourceRepository;
        this.sourceSelector = sourceSelector;
        this.providerFanOut = providerFanOut;
        this.aggregator = aggregator;
        this.searchProperties = searchProperties;
    }

    public Mono<ResourceSearchResponse> search(ResourceSearchRequest request) {
        return Mono.defer(() -> {
            String query = SearchQueryUtils.normalizeOrNull(request.query());
            ResourceFilter filter = new ResourceFilter(
                query,
                parseType(request.type()),
                request.level(),
                SearchQueryUtils.normalizeOrNull(request.department()),
                SearchQueryUtils.normalizeOrNull(request.course())
            );
            if (!filter.hasQuery() && !filter.hasStructuredCriteria()) {
                return Mono.error(new InvalidSearchRequestException(
                    "Provide a search query or at least one filter (type, level, department, course)"));
            }

            int page = resolvePage(request.page());
            int limit = resolveLimit(request.limit());
            SourceSelection selection = sourceSelector.select(request.sources(), filter.hasQuery());
            ExternalApiLogger.logFanOutStart(log, query, selection.names());

            Mono<ResourcePage> local = selection.includeLocal()
                ? Mono.fromCallable(() -> resourceRepository.find(filter, page, limit))
                    .subscribeOn(Schedulers.boundedElastic())
                : Mono.just(new ResourcePage(List.of(), 0L, page, limit));
            Mono<Map<String, List<CandidateRecord>>> external =
                providerFanOut.searchAll(selection.externalAdapters(), query, limit);

            Duration deadline = searchProperties.getRequestTimeout();
            return Mono.zip(local, external)
                .map(joined -> aggregator.compose(joined.getT1(), joined.getT2(), limit))
                .timeout(deadline)
                .onErrorMap(TimeoutException.class, ex -> new SearchTimeoutException(deadline, ex))
                .doOnNext(response -> ExternalApiLogger.logFanOutComplete(
                    log, query, response.counts().local(), response.counts().external()));
        });
    }

    private ResourceType parseType(String rawType) {
        String normalized = SearchQueryUtils.normalizeOrNull(rawType);
        if (normalized == null) {
            return null;
        }
        ResourceType type = ResourceType.fromWire(normalized);
        if (type == null) {
            throw new InvalidSearchRequestException("Unknown resource type: " + rawType);
        }
        return type;
    }

    private int resolvePage(Integer page) {
        return page == null || page < 1 ? 1 : page;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null || limit < 1) {
            return searchProperties.getDefaultLimit();
        }
        return Math.min(limit, searchProperties.getMaxLimit());
    }
}
