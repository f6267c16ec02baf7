package net.unishelf.domain.resource;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted library resource, created by upload or by importing an external candidate.
 */
public record Resource(
    UUID id,
    String title,
    String description,
    ResourceType resourceType,
    String format,
    @Nullable String author,
    @Nullable String publisher,
    @Nullable Integer publicationYear,
    @Nullable String isbn,
    List<String> tags,
    List<String> departmentIds,
    List<String> courseIds,
    @Nullable Integer level,
    @Nullable String fileUrl,
    @Nullable String externalLink,
    @Nullable String thumbnail,
    String uploaderId,
    AccessLevel accessLevel,
    boolean approved,
    boolean featured,
    long views,
    long downloads,
    long shares,
    double averageRating,
    int ratingsCount,
    @Nullable String sourceName,
    @Nullable String sourceExternalId,
    Instant createdAt,
    Instant updatedAt
) {

    public Resource {
        tags = tags == null ? List.of() : List.copyOf(tags);
        departmentIds = departmentIds == null ? List.of() : List.copyOf(departmentIds);
        courseIds = courseIds == null ? List.of() : List.copyOf(courseIds);
    }

    /** Where a download should send the caller: the stored file, else the external link. */
    @Nullable
    public String downloadTarget() {
        if (fileUrl != null && !fileUrl.isBlank()) {
            return fileUrl;
        }
        if (externalLink != null && !externalLink.isBlank()) {
            return externalLink;
        }
        return null;
    }
}
