package net.unishelf.domain.resource;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Normalized search hit produced by an external provider. Never persisted on its
 * own; it becomes a {@link Resource} only when imported.
 *
 * <p>Text fields default to the empty string and link fields to {@code null}
 * so a sparse upstream record still yields a usable candidate.</p>
 */
public record CandidateRecord(
    String id,
    String title,
    String description,
    List<String> authors,
    String publishedDate,
    @Nullable String thumbnail,
    @Nullable String previewLink,
    @Nullable String infoLink,
    String sourceName,
    String sourceExternalId
) {

    public static final String UNKNOWN_AUTHOR = "Unknown";

    public CandidateRecord {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        authors = authors == null || authors.isEmpty() ? List.of(UNKNOWN_AUTHOR) : List.copyOf(authors);
        publishedDate = publishedDate == null ? "" : publishedDate;
        sourceName = sourceName == null ? "" : sourceName;
        sourceExternalId = sourceExternalId == null ? (id == null ? "" : id) : sourceExternalId;
    }

    /** First non-blank of preview and info link, or {@code null}. */
    @Nullable
    public String usableLink() {
        if (previewLink != null && !previewLink.isBlank()) {
            return previewLink;
        }
        if (infoLink != null && !infoLink.isBlank()) {
            return infoLink;
        }
        return null;
    }
}
