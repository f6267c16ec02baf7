package net.unishelf.service.provider;

import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ProviderCategory;
import reactor.core.publisher.Mono;

/**
 * Uniform search capability of one external bibliographic provider.
 *
 * <p>Implementations know only their own provider's wire format. The returned
 * {@link Mono} never errors for ordinary failure modes (HTTP errors, malformed
 * payloads, missing credentials); those resolve to an empty list.</p>
 */
public interface ExternalProviderAdapter {

    /** Token used in the {@code sources} request parameter and as the response key. */
    String name();

    /** Human readable source name stamped on every candidate. */
    String displayName();

    ProviderCategory category();

    /** Switched on and, where the provider needs one, holding a credential. */
    boolean isEnabled();

    Mono<List<CandidateRecord>> search(String query, int maxResults);
}
