package net.unishelf.application.resource;

import jakarta.annotation.Nullable;
import java.util.List;
import net.unishelf.domain.caller.CallerIdentity;

/**
 * Metadata of an uploaded resource. File bytes are held by the storage
 * collaborator; this carries only its URL, name and MIME type.
 */
public record ResourceUploadCommand(
    CallerIdentity uploader,
    String title,
    @Nullable String description,
    String resourceType,
    @Nullable String author,
    @Nullable String publisher,
    @Nullable Integer publicationYear,
    @Nullable String isbn,
    List<String> tags,
    List<String> departmentIds,
    List<String> courseIds,
    @Nullable Integer level,
    @Nullable String fileUrl,
    @Nullable String fileName,
    @Nullable String mimeType,
    @Nullable String externalLink,
    @Nullable String thumbnail,
    @Nullable String accessLevel
) {
}
