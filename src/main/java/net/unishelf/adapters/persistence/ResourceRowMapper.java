package net.unishelf.adapters.persistence;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceType;
import org.springframework.jdbc.core.RowMapper;

/**
 * Maps a {@code resources} row to the domain record.
 */
final class ResourceRowMapper implements RowMapper<Resource> {

    static final ResourceRowMapper INSTANCE = new ResourceRowMapper();

    private ResourceRowMapper() {
    }

    @Override
    public Resource mapRow(ResultSet rs, int rowNum) throws SQLException {
        ResourceType type = ResourceType.fromWire(rs.getString("resource_type"));
        return new Resource(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getString("description"),
            type == null ? ResourceType.OTHER : type,
            rs.getString("format"),
            rs.getString("author"),
            rs.getString("publisher"),
            nullableInt(rs, "publication_year"),
            rs.getString("isbn"),
            textArray(rs.getArray("tags")),
            textArray(rs.getArray("department_ids")),
            textArray(rs.getArray("course_ids")),
            nullableInt(rs, "level"),
            rs.getString("file_url"),
            rs.getString("external_link"),
            rs.getString("thumbnail"),
            rs.getString("uploader_id"),
            AccessLevel.fromWireOrPublic(rs.getString("access_level")),
            rs.getBoolean("is_approved"),
            rs.getBoolean("is_featured"),
            rs.getLong("views"),
            rs.getLong("downloads"),
            rs.getLong("shares"),
            rs.getDouble("average_rating"),
            rs.getInt("ratings_count"),
            rs.getString("source_name"),
            rs.getString("source_external_id"),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("updated_at"))
        );
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static List<String> textArray(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object raw = array.getArray();
        if (raw instanceof String[] values) {
            return Arrays.asList(values);
        }
        return List.of();
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
