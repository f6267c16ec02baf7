package net.unishelf.service.provider.arxiv;

import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ProviderCategory;
import net.unishelf.service.provider.AbstractExternalProviderAdapter;
import net.unishelf.service.provider.ProviderCallSupport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * arXiv preprint search over the Atom export API. Needs no credential.
 */
@Component
public class ArxivProviderAdapter extends AbstractExternalProviderAdapter {

    public static final String NAME = "arxiv";

    private final WebClient webClient;

    public ArxivProviderAdapter(WebClient.Builder webClientBuilder,
                                ProviderCallSupport support,
                                @Value("${arxiv.api.base-url:https://export.arxiv.org/api}") String baseUrl,
                                @Value("${app.providers.arxiv.enabled:true}") boolean enabled) {
        super(NAME, ArxivCandidateMapper.SOURCE_NAME, ProviderCategory.PREPRINT_ARCHIVE, enabled, support);
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
    }

    @Override
    protected Mono<List<CandidateRecord>> fetch(String query, int maxResults) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("search_query", "all:{query}")
                .queryParam("start", 0)
                .queryParam("max_results", maxResults)
                .build(query))
            .retrieve()
            .bodyToMono(String.class)
            .map(ArxivCandidateMapper::fromFeed)
            .onErrorMap(this::unavailable);
    }
}
