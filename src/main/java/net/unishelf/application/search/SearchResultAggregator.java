package net.unishelf.application.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.ResourcePage;
import org.springframework.stereotype.Component;

/**
 * Merges the local page and the per-provider candidate lists into one envelope.
 */
@Component
public class SearchResultAggregator {

    public ResourceSearchResponse compose(ResourcePage localPage,
                                          Map<String, List<CandidateRecord>> external,
                                          int maxExternalPerProvider) {
        Map<String, List<CandidateRecord>> capped = new LinkedHashMap<>();
        int externalCount = 0;
        for (Map.Entry<String, List<CandidateRecord>> entry : external.entrySet()) {
            List<CandidateRecord> candidates = entry.getValue() == null ? List.of() : entry.getValue();
            if (candidates.size() > maxExternalPerProvider) {
                candidates = candidates.subList(0, maxExternalPerProvider);
            }
            capped.put(entry.getKey(), List.copyOf(candidates));
            externalCount += candidates.size();
        }

        return new ResourceSearchResponse(
            true,
            new ResourceSearchResponse.Counts(localPage.totalCount(), externalCount),
            new ResourceSearchResponse.Pagination(localPage.page(), localPage.limit(), localPage.pages()),
            new ResourceSearchResponse.Data(localPage.items(), capped)
        );
    }
}
