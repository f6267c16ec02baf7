package net.unishelf.domain.resource;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Validated field set for a resource that is about to be inserted.
 */
public record ResourceDraft(
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
    @Nullable String sourceName,
    @Nullable String sourceExternalId
) {

    public ResourceDraft {
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(tags);
        departmentIds = departmentIds == null ? List.of() : List.copyOf(departmentIds);
        courseIds = courseIds == null ? List.of() : List.copyOf(courseIds);
    }
}
