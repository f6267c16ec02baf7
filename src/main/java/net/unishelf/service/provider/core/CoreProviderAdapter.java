package net.unishelf.service.provider.core;

import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ProviderCategory;
import net.unishelf.service.provider.AbstractExternalProviderAdapter;
import net.unishelf.service.provider.ProviderCallSupport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * CORE open-access research works. Requires a bearer API key; without one the provider is disabled.
 */
@Component
public class CoreProviderAdapter extends AbstractExternalProviderAdapter {

    public static final String NAME = "core";

    private final WebClient webClient;
    private final String apiKey;

    public CoreProviderAdapter(WebClient.Builder webClientBuilder,
                               ProviderCallSupport support,
                               @Value("${core.api.base-url:https://api.core.ac.uk/v3}") String baseUrl,
                               @Value("${core.api.key:}") String apiKey,
                               @Value("${app.providers.core.enabled:true}") boolean enabled) {
        super(NAME, CoreCandidateMapper.SOURCE_NAME, ProviderCategory.OPEN_ACCESS_REPOSITORY, enabled, support);
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.apiKey = apiKey;
    }

    @Override
    protected Mono<List<CandidateRecord>> fetch(String query, int maxResults) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/search/works")
                .queryParam("q", "{q}")
                .queryParam("limit", maxResults)
                .build(query))
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(CoreCandidateMapper::fromSearchResponse)
            .onErrorMap(this::unavailable);
    }

    @Override
    protected boolean requiresCredential() {
        return true;
    }

    @Override
    protected String credential() {
        return apiKey;
    }
}
