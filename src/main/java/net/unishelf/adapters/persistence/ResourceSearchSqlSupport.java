package net.unishelf.adapters.persistence;

import java.util.ArrayList;
import java.util.List;
import net.unishelf.domain.resource.ResourceFilter;

/**
 * Builds the page and count statements for a local resource search.
 *
 * <p>Both statements share one WHERE clause so the count is an independent query
 * over exactly the same filter as the page.</p>
 */
final class ResourceSearchSqlSupport {

    static final String TS_CONFIG = "english";

    private ResourceSearchSqlSupport() {
    }

    record SqlStatement(String sql, List<Object> params) {
        Object[] args() {
            return params.toArray();
        }
    }

    static SqlStatement pageStatement(ResourceFilter filter, int page, int limit) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT r.* FROM resources r WHERE ");
        sql.append(whereClause(filter, params));
        if (filter.hasQuery()) {
            sql.append(" ORDER BY ts_rank(r.search_vector, websearch_to_tsquery('")
                .append(TS_CONFIG)
                .append("', ?)) DESC, r.created_at DESC");
            params.add(filter.query().trim());
        } else {
            sql.append(" ORDER BY r.created_at DESC");
        }
        sql.append(" LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset(page, limit));
        return new SqlStatement(sql.toString(), List.copyOf(params));
    }

    static SqlStatement countStatement(ResourceFilter filter) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM resources r WHERE " + whereClause(filter, params);
        return new SqlStatement(sql, List.copyOf(params));
    }

    static long offset(int page, int limit) {
        return (long) (page - 1) * limit;
    }

    private static String whereClause(ResourceFilter filter, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        clauses.add("r.is_approved = true");
        if (filter.hasQuery()) {
            clauses.add("r.search_vector @@ websearch_to_tsquery('" + TS_CONFIG + "', ?)");
            params.add(filter.query().trim());
        }
        if (filter.type() != null) {
            clauses.add("r.resource_type = ?");
            params.add(filter.type().wireValue());
        }
        if (filter.level() != null) {
            clauses.add("r.level = ?");
            params.add(filter.level());
        }
        if (filter.departmentId() != null && !filter.departmentId().isBlank()) {
            clauses.add("? = ANY(r.department_ids)");
            params.add(filter.departmentId().trim());
        }
        if (filter.courseId() != null && !filter.courseId().isBlank()) {
            clauses.add("? = ANY(r.course_ids)");
            params.add(filter.courseId().trim());
        }
        return String.join(" AND ", clauses);
    }
}
