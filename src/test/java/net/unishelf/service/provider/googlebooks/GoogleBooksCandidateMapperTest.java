package net.unishelf.service.provider.googlebooks;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.unishelf.domain.resource.CandidateRecord;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

class GoogleBooksCandidateMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromSearchResponse_MapsVolumeFields() {
        JsonNode response = objectMapper.readTree("""
            {"items": [{
              "id": "zyTCAlFPjgYC",
              "volumeInfo": {
                "title": "Computer Networks",
                "description": "A top-down approach",
                "authors": ["Andrew S. Tanenbaum", "David Wetherall"],
                "publishedDate": "2010-09-27",
                "imageLinks": {"thumbnail": "http://books.google.com/thumb.jpg"},
                "previewLink": "http://books.google.com/preview",
                "infoLink": "http://books.google.com/info"
              }
            }]}
            """);

        List<CandidateRecord> candidates = GoogleBooksCandidateMapper.fromSearchResponse(response);

        assertThat(candidates).hasSize(1);
        CandidateRecord candidate = candidates.get(0);
        assertThat(candidate.id()).isEqualTo("zyTCAlFPjgYC");
        assertThat(candidate.title()).isEqualTo("Computer Networks");
        assertThat(candidate.description()).isEqualTo("A top-down approach");
        assertThat(candidate.authors()).containsExactly("Andrew S. Tanenbaum", "David Wetherall");
        assertThat(candidate.publishedDate()).isEqualTo("2010-09-27");
        assertThat(candidate.thumbnail()).isEqualTo("http://books.google.com/thumb.jpg");
        assertThat(candidate.previewLink()).isEqualTo("http://books.google.com/preview");
        assertThat(candidate.infoLink()).isEqualTo("http://books.google.com/info");
        assertThat(candidate.sourceName()).isEqualTo("Google Books");
        assertThat(candidate.sourceExternalId()).isEqualTo("zyTCAlFPjgYC");
    }

    @Test
    void fromSearchResponse_SparseVolume_UsesDefaults() {
        JsonNode response = objectMapper.readTree("""
            {"items": [{"id": "abc", "volumeInfo": {"title": "Untitled Notes"}}, {"volumeInfo": {"title": "no id"}}]}
            """);

        List<CandidateRecord> candidates = GoogleBooksCandidateMapper.fromSearchResponse(response);

        assertThat(candidates).hasSize(1);
        CandidateRecord candidate = candidates.get(0);
        assertThat(candidate.description()).isEmpty();
        assertThat(candidate.authors()).containsExactly("Unknown");
        assertThat(candidate.thumbnail()).isNull();
        assertThat(candidate.usableLink()).isNull();
    }

    @Test
    void fromSearchResponse_NoItems_ReturnsEmpty() {
        assertThat(GoogleBooksCandidateMapper.fromSearchResponse(objectMapper.readTree("{\"totalItems\": 0}"))).isEmpty();
        assertThat(GoogleBooksCandidateMapper.fromSearchResponse(null)).isEmpty();
    }
}
