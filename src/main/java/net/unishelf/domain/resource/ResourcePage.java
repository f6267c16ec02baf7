package net.unishelf.domain.resource;

import java.util.List;

/**
 * One page of local resources plus the independently counted total.
 */
public record ResourcePage(List<Resource> items, long totalCount, int page, int limit) {

    public ResourcePage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /** {@code ceil(totalCount / limit)}. */
    public int pages() {
        if (limit <= 0) {
            return 0;
        }
        return (int) ((totalCount + limit - 1) / limit);
    }
}
