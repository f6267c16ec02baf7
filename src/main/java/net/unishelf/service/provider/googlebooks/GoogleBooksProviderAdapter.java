package net.unishelf.service.provider.googlebooks;

import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ProviderCategory;
import net.unishelf.service.provider.AbstractExternalProviderAdapter;
import net.unishelf.service.provider.ProviderCallSupport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Google Books volumes search. Requires an API key; without one the provider is disabled.
 */
@Component
public class GoogleBooksProviderAdapter extends AbstractExternalProviderAdapter {

    public static final String NAME = "googleBooks";

    // Google Books caps maxResults at 40 per request
    private static final int MAX_PAGE_SIZE = 40;

    private final WebClient webClient;
    private final String apiKey;

    public GoogleBooksProviderAdapter(WebClient.Builder webClientBuilder,
                                      ProviderCallSupport support,
                                      @Value("${google.books.api.base-url:https://www.googleapis.com/books/v1}") String baseUrl,
                                      @Value("${google.books.api.key:}") String apiKey,
                                      @Value("${app.providers.google-books.enabled:true}") boolean enabled) {
        super(NAME, GoogleBooksCandidateMapper.SOURCE_NAME, ProviderCategory.BOOK_CATALOG, enabled, support);
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.apiKey = apiKey;
    }

    @Override
    protected Mono<List<CandidateRecord>> fetch(String query, int maxResults) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/volumes")
                .queryParam("q", "{q}")
                .queryParam("maxResults", Math.min(maxResults, MAX_PAGE_SIZE))
                .queryParam("key", "{key}")
                .build(query, apiKey))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(GoogleBooksCandidateMapper::fromSearchResponse)
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
