package net.unishelf.domain.resource;

import jakarta.annotation.Nullable;

/**
 * Structured filter for the local resource store. Only approved resources are
 * ever matched by a search.
 */
public record ResourceFilter(
    @Nullable String query,
    @Nullable ResourceType type,
    @Nullable Integer level,
    @Nullable String departmentId,
    @Nullable String courseId
) {

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public boolean hasStructuredCriteria() {
        return type != null
            || level != null
            || (departmentId != null && !departmentId.isBlank())
            || (courseId != null && !courseId.isBlank());
    }
}
