package net.unishelf.domain.resource;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Visibility of a resource to callers other than its uploader.
 */
public enum AccessLevel {
    PUBLIC,
    DEPARTMENT,
    COURSE,
    PRIVATE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a wire token; blank or unknown values fall back to {@link #PUBLIC}. */
    public static AccessLevel fromWireOrPublic(String raw) {
        if (raw == null) {
            return PUBLIC;
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (AccessLevel level : values()) {
            if (level.wireValue().equals(wanted)) {
                return level;
            }
        }
        return PUBLIC;
    }
}
