package net.unishelf.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.List;

/**
 * Candidate as echoed back by a client that picked it from search results.
 * Accepts both the search response field names and the short {@code source}/{@code externalId} forms.
 */
public record CandidatePayload(
    String id,
    String title,
    String description,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> authors,
    String publishedDate,
    String thumbnail,
    String previewLink,
    String infoLink,
    @JsonAlias("source") String sourceName,
    @JsonAlias("externalId") String sourceExternalId
) {
}
