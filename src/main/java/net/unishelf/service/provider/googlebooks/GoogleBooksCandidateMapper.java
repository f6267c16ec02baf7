package net.unishelf.service.provider.googlebooks;

import java.util.ArrayList;
import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.service.provider.ProviderPayloads;
import tools.jackson.databind.JsonNode;

/**
 * The only code that reads Google Books volume payloads.
 */
final class GoogleBooksCandidateMapper {

    static final String SOURCE_NAME = "Google Books";

    private GoogleBooksCandidateMapper() {
    }

    /**
     * Maps {@code items[]} of a volumes search response. Items without an id are skipped.
     */
    static List<CandidateRecord> fromSearchResponse(JsonNode response) {
        List<CandidateRecord> candidates = new ArrayList<>();
        if (response == null) {
            return candidates;
        }
        JsonNode items = response.path("items");
        if (!items.isArray()) {
            return candidates;
        }
        for (JsonNode item : items) {
            CandidateRecord candidate = fromVolume(item);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    static CandidateRecord fromVolume(JsonNode item) {
        String id = ProviderPayloads.text(item, "id");
        if (id == null) {
            return null;
        }
        JsonNode volumeInfo = item.path("volumeInfo");
        return new CandidateRecord(
            id,
            ProviderPayloads.text(volumeInfo, "title"),
            ProviderPayloads.text(volumeInfo, "description"),
            ProviderPayloads.textList(volumeInfo, "authors"),
            ProviderPayloads.text(volumeInfo, "publishedDate"),
            ProviderPayloads.text(volumeInfo.path("imageLinks"), "thumbnail"),
            ProviderPayloads.text(volumeInfo, "previewLink"),
            ProviderPayloads.text(volumeInfo, "infoLink"),
            SOURCE_NAME,
            id
        );
    }
}
