package net.unishelf.application.search;

import java.util.List;
import java.util.Map;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.Resource;

/**
 * Combined search envelope. Local and external results stay in separate sections
 * because only the local section is paginated.
 */
public record ResourceSearchResponse(
    boolean success,
    Counts counts,
    Pagination pagination,
    Data data
) {

    /** {@code local} is the local total match count; {@code external} sums all provider lists. */
    public record Counts(long local, int external) {
    }

    public record Pagination(int page, int limit, int pages) {
    }

    public record Data(List<Resource> local, Map<String, List<CandidateRecord>> external) {
    }
}
