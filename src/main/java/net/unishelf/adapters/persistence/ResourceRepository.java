package net.unishelf.adapters.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceDraft;
import net.unishelf.domain.resource.ResourceFilter;
import net.unishelf.domain.resource.ResourcePage;
import net.unishelf.domain.resource.ResourceRating;
import net.unishelf.domain.resource.ResourceRatings;
import net.unishelf.domain.resource.ResourceType;
import net.unishelf.exception.LocalStoreFailureException;
import net.unishelf.exception.ResourceNotFoundException;
import net.unishelf.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for the local resource store.
 *
 * <p>Owns all SQL for the {@code resources} and {@code resource_ratings} tables.
 * Any {@link DataAccessException} leaves this class as a
 * {@link LocalStoreFailureException}.</p>
 */
@Repository
public class ResourceRepository {

    private static final Logger log = LoggerFactory.getLogger(ResourceRepository.class);

    /** Engagement counters that may be bumped atomically. */
    public enum Counter {
        VIEWS("views"),
        DOWNLOADS("downloads"),
        SHARES("shares");

        private final String column;

        Counter(String column) {
            this.column = column;
        }
    }

    /** Rating state right after an upsert. */
    public record RatingUpdate(ResourceRating rating, double averageRating, int ratingsCount) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ResourceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns one page of approved resources matching the filter plus the total
     * match count, computed by a separate count query.
     */
    @Transactional(readOnly = true)
    public ResourcePage find(ResourceFilter filter, int page, int limit) {
        if (filter == null) {
            throw new IllegalArgumentException("filter is required");
        }
        ResourceSearchSqlSupport.SqlStatement pageSql = ResourceSearchSqlSupport.pageStatement(filter, page, limit);
        ResourceSearchSqlSupport.SqlStatement countSql = ResourceSearchSqlSupport.countStatement(filter);
        return execute("search", () -> {
            List<Resource> items = jdbcTemplate.query(pageSql.sql(), ResourceRowMapper.INSTANCE, pageSql.args());
            Long total = jdbcTemplate.queryForObject(countSql.sql(), Long.class, countSql.args());
            return new ResourcePage(items, total == null ? 0L : total, page, limit);
        });
    }

    @Transactional(readOnly = true)
    public Optional<Resource> findById(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        return execute("findById", () -> jdbcTemplate.query(
            "SELECT * FROM resources WHERE id = ?",
            ResourceRowMapper.INSTANCE,
            id
        ).stream().findFirst());
    }

    /**
     * Oldest resource previously imported from the given provider record.
     */
    @Transactional(readOnly = true)
    public Optional<Resource> findBySource(String sourceName, String sourceExternalId) {
        if (sourceName == null || sourceName.isBlank() || sourceExternalId == null || sourceExternalId.isBlank()) {
            return Optional.empty();
        }
        return execute("findBySource", () -> jdbcTemplate.query(
            """
            SELECT * FROM resources
            WHERE source_name = ? AND source_external_id = ?
            ORDER BY created_at ASC
            LIMIT 1
            """,
            ResourceRowMapper.INSTANCE,
            sourceName,
            sourceExternalId
        ).stream().findFirst());
    }

    @Transactional
    public Resource insert(ResourceDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft is required");
        }
        UUID id = IdGenerator.uuidV7();
        Timestamp now = Timestamp.from(Instant.now());
        String sql = """
            INSERT INTO resources (
                id, title, description, resource_type, format, author, publisher, publication_year, isbn,
                tags, department_ids, course_ids, level, file_url, external_link, thumbnail,
                uploader_id, access_level, is_approved, source_name, source_external_id, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        execute("insert", () -> jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            int i = 1;
            ps.setObject(i++, id);
            ps.setString(i++, draft.title());
            ps.setString(i++, draft.description());
            ps.setString(i++, draft.resourceType().wireValue());
            ps.setString(i++, draft.format());
            ps.setString(i++, draft.author());
            ps.setString(i++, draft.publisher());
            setNullableInt(ps, i++, draft.publicationYear());
            ps.setString(i++, draft.isbn());
            ps.setArray(i++, textArray(connection, draft.tags()));
            ps.setArray(i++, textArray(connection, draft.departmentIds()));
            ps.setArray(i++, textArray(connection, draft.courseIds()));
            setNullableInt(ps, i++, draft.level());
            ps.setString(i++, draft.fileUrl());
            ps.setString(i++, draft.externalLink());
            ps.setString(i++, draft.thumbnail());
            ps.setString(i++, draft.uploaderId());
            ps.setString(i++, draft.accessLevel().wireValue());
            ps.setBoolean(i++, draft.approved());
            ps.setString(i++, draft.sourceName());
            ps.setString(i++, draft.sourceExternalId());
            ps.setTimestamp(i++, now);
            ps.setTimestamp(i, now);
            return ps;
        }));
        return findById(id).orElseThrow(() -> new IllegalStateException("Inserted resource " + id + " not readable"));
    }

    /**
     * Atomically increments one counter and returns the updated row.
     */
    @Transactional
    public Optional<Resource> incrementCounter(UUID id, Counter counter) {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        String sql = "UPDATE resources SET " + counter.column + " = " + counter.column + " + 1 WHERE id = ? RETURNING *";
        return execute("increment " + counter.column, () -> jdbcTemplate.query(sql, ResourceRowMapper.INSTANCE, id)
            .stream()
            .findFirst());
    }

    @Transactional(readOnly = true)
    public ResourceRatings loadRatings(UUID resourceId) {
        return execute("loadRatings", () -> ResourceRatings.of(jdbcTemplate.query(
            "SELECT rater_id, score, review, rated_at FROM resource_ratings WHERE resource_id = ? ORDER BY rated_at ASC",
            (rs, rowNum) -> new ResourceRating(
                rs.getString("rater_id"),
                rs.getInt("score"),
                rs.getString("review"),
                rs.getTimestamp("rated_at").toInstant()
            ),
            resourceId
        )));
    }

    /**
     * Upserts the rater's slot and recomputes the average while holding the
     * resource row lock, so concurrent ratings of one resource apply one at a time.
     */
    @Transactional
    public RatingUpdate upsertRating(UUID resourceId, ResourceRating rating) {
        if (resourceId == null || rating == null) {
            throw new IllegalArgumentException("resourceId and rating are required");
        }
        return execute("upsertRating", () -> {
            List<UUID> locked = jdbcTemplate.query(
                "SELECT id FROM resources WHERE id = ? FOR UPDATE",
                (rs, rowNum) -> rs.getObject("id", UUID.class),
                resourceId
            );
            if (locked.isEmpty()) {
                throw new ResourceNotFoundException(resourceId);
            }

            ResourceRatings next = loadRatings(resourceId).upsert(rating);
            jdbcTemplate.update(
                """
                INSERT INTO resource_ratings (resource_id, rater_id, score, review, rated_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (resource_id, rater_id)
                DO UPDATE SET score = EXCLUDED.score, review = EXCLUDED.review, rated_at = EXCLUDED.rated_at
                """,
                resourceId,
                rating.raterId(),
                rating.score(),
                rating.review(),
                Timestamp.from(rating.ratedAt())
            );
            double average = next.average();
            jdbcTemplate.update(
                "UPDATE resources SET average_rating = ?, ratings_count = ?, updated_at = now() WHERE id = ?",
                average,
                next.size(),
                resourceId
            );
            return new RatingUpdate(rating, average, next.size());
        });
    }

    /**
     * Approved resources sharing a course, the type, or a tag with the given one.
     */
    @Transactional(readOnly = true)
    public List<Resource> findRelated(Resource resource, int limit) {
        return execute("findRelated", () -> jdbcTemplate.query(
            connection -> {
                PreparedStatement ps = connection.prepareStatement("""
                    SELECT * FROM resources
                    WHERE id <> ?
                      AND is_approved = true
                      AND (course_ids && ? OR resource_type = ? OR tags && ?)
                    ORDER BY views DESC, created_at DESC
                    LIMIT ?
                    """);
                ps.setObject(1, resource.id());
                ps.setArray(2, textArray(connection, resource.courseIds()));
                ps.setString(3, resource.resourceType().wireValue());
                ps.setArray(4, textArray(connection, resource.tags()));
                ps.setInt(5, limit);
                return ps;
            },
            ResourceRowMapper.INSTANCE
        ));
    }

    @Transactional(readOnly = true)
    public List<Resource> findFeatured(ResourceType type, int limit) {
        return listApproved("is_featured = true", "created_at DESC", type, limit);
    }

    @Transactional(readOnly = true)
    public List<Resource> findTrending(ResourceType type, int limit) {
        return listApproved(null, "views DESC, downloads DESC, created_at DESC", type, limit);
    }

    @Transactional(readOnly = true)
    public List<Resource> findRecent(ResourceType type, int limit) {
        return listApproved(null, "created_at DESC", type, limit);
    }

    @Transactional(readOnly = true)
    public List<Resource> findTopRated(ResourceType type, int limit) {
        return listApproved("ratings_count > 0", "average_rating DESC, ratings_count DESC", type, limit);
    }

    private List<Resource> listApproved(String extraClause, String orderBy, ResourceType type, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM resources WHERE is_approved = true");
        if (extraClause != null) {
            sql.append(" AND ").append(extraClause);
        }
        if (type != null) {
            sql.append(" AND resource_type = ?");
        }
        sql.append(" ORDER BY ").append(orderBy).append(" LIMIT ?");
        Object[] args = type == null
            ? new Object[] {limit}
            : new Object[] {type.wireValue(), limit};
        return execute("listApproved", () -> jdbcTemplate.query(sql.toString(), ResourceRowMapper.INSTANCE, args));
    }

    private static java.sql.Array textArray(Connection connection, List<String> values) throws SQLException {
        return connection.createArrayOf("text", values.toArray(new String[0]));
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            log.error("Local store operation '{}' failed", operation, ex);
            throw new LocalStoreFailureException("Local store operation '" + operation + "' failed", ex);
        }
    }
}
