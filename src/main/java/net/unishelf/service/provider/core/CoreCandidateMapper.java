package net.unishelf.service.provider.core;

import java.util.ArrayList;
import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.service.provider.ProviderPayloads;
import tools.jackson.databind.JsonNode;

/**
 * The only code that reads CORE v3 {@code search/works} payloads.
 */
final class CoreCandidateMapper {

    static final String SOURCE_NAME = "CORE";
    private static final String DISPLAY_LINK_TYPE = "display";

    private CoreCandidateMapper() {
    }

    static List<CandidateRecord> fromSearchResponse(JsonNode response) {
        List<CandidateRecord> candidates = new ArrayList<>();
        if (response == null) {
            return candidates;
        }
        JsonNode results = response.path("results");
        if (!results.isArray()) {
            return candidates;
        }
        for (JsonNode work : results) {
            CandidateRecord candidate = fromWork(work);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    static CandidateRecord fromWork(JsonNode work) {
        String id = ProviderPayloads.text(work, "id");
        if (id == null) {
            return null;
        }
        String displayLink = extractLink(work, DISPLAY_LINK_TYPE);
        String downloadUrl = ProviderPayloads.text(work, "downloadUrl");
        String previewLink = downloadUrl != null ? downloadUrl : extractLink(work, null);
        return new CandidateRecord(
            id,
            ProviderPayloads.text(work, "title"),
            ProviderPayloads.text(work, "abstract"),
            extractAuthors(work),
            ProviderPayloads.text(work, "yearPublished"),
            null,
            previewLink,
            displayLink,
            SOURCE_NAME,
            id
        );
    }

    private static List<String> extractAuthors(JsonNode work) {
        List<String> authors = new ArrayList<>();
        JsonNode authorNodes = work.path("authors");
        if (!authorNodes.isArray()) {
            return authors;
        }
        for (JsonNode author : authorNodes) {
            String name = ProviderPayloads.text(author, "name");
            if (name != null) {
                authors.add(name);
            }
        }
        return authors;
    }

    /**
     * First link of the given type, or the first link at all when {@code type} is null.
     */
    private static String extractLink(JsonNode work, String type) {
        JsonNode links = work.path("links");
        if (!links.isArray()) {
            return null;
        }
        for (JsonNode link : links) {
            if (type == null || type.equals(ProviderPayloads.text(link, "type"))) {
                String url = ProviderPayloads.text(link, "url");
                if (url != null) {
                    return url;
                }
            }
        }
        return null;
    }
}
