package net.unishelf.service.provider.openlibrary;

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
 * Open Library search. Needs no credential.
 */
@Component
public class OpenLibraryProviderAdapter extends AbstractExternalProviderAdapter {

    public static final String NAME = "openLibrary";

    private static final String SEARCH_FIELDS = "key,title,author_name,first_publish_year,cover_i";

    private final WebClient webClient;

    public OpenLibraryProviderAdapter(WebClient.Builder webClientBuilder,
                                      ProviderCallSupport support,
                                      @Value("${openlibrary.data.api.url:https://openlibrary.org}") String baseUrl,
                                      @Value("${app.providers.open-library.enabled:true}") boolean enabled) {
        super(NAME, OpenLibraryCandidateMapper.SOURCE_NAME, ProviderCategory.BOOK_CATALOG, enabled, support);
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
    }

    @Override
    protected Mono<List<CandidateRecord>> fetch(String query, int maxResults) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/search.json")
                .queryParam("q", "{q}")
                .queryParam("limit", maxResults)
                .queryParam("fields", SEARCH_FIELDS)
                .build(query))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(OpenLibraryCandidateMapper::fromSearchResponse)
            .onErrorMap(this::unavailable);
    }
}
