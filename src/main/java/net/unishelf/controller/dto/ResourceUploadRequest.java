package net.unishelf.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.List;

/**
 * Upload metadata. List fields also accept a single comma separated string.
 */
public record ResourceUploadRequest(
    String title,
    String description,
    String resourceType,
    String author,
    String publisher,
    Integer publicationYear,
    String isbn,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> tags,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> departmentIds,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> courseIds,
    Integer level,
    String fileUrl,
    String fileName,
    String mimeType,
    String externalLink,
    String thumbnail,
    String accessLevel
) {
}
