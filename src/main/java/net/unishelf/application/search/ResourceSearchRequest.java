package net.unishelf.application.search;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Raw search input as received from the HTTP layer. Normalized by {@link ResourceSearchUseCase}.
 */
public record ResourceSearchRequest(
    @Nullable String query,
    @Nullable String type,
    @Nullable Integer level,
    @Nullable String department,
    @Nullable String course,
    @Nullable List<String> sources,
    @Nullable Integer page,
    @Nullable Integer limit
) {
}
