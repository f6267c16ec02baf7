package net.unishelf.service.provider.openlibrary;

import java.util.ArrayList;
import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.service.provider.ProviderPayloads;
import tools.jackson.databind.JsonNode;

/**
 * The only code that reads Open Library {@code search.json} payloads.
 */
final class OpenLibraryCandidateMapper {

    static final String SOURCE_NAME = "Open Library";
    private static final String SITE_URL = "https://openlibrary.org";
    private static final String COVER_URL_TEMPLATE = "https://covers.openlibrary.org/b/id/%s-M.jpg";

    private OpenLibraryCandidateMapper() {
    }

    static List<CandidateRecord> fromSearchResponse(JsonNode response) {
        List<CandidateRecord> candidates = new ArrayList<>();
        if (response == null) {
            return candidates;
        }
        JsonNode docs = response.path("docs");
        if (!docs.isArray()) {
            return candidates;
        }
        for (JsonNode doc : docs) {
            CandidateRecord candidate = fromDoc(doc);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    static CandidateRecord fromDoc(JsonNode doc) {
        String key = ProviderPayloads.text(doc, "key");
        if (key == null) {
            return null;
        }
        String link = SITE_URL + key;
        return new CandidateRecord(
            key,
            ProviderPayloads.text(doc, "title"),
            "",
            ProviderPayloads.textList(doc, "author_name"),
            ProviderPayloads.text(doc, "first_publish_year"),
            extractCover(doc),
            link,
            link,
            SOURCE_NAME,
            key
        );
    }

    private static String extractCover(JsonNode doc) {
        String coverId = ProviderPayloads.text(doc, "cover_i");
        return coverId == null ? null : String.format(COVER_URL_TEMPLATE, coverId);
    }
}
