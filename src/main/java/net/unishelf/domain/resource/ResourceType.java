package net.unishelf.domain.resource;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kind of material a library resource points at.
 */
public enum ResourceType {
    DOCUMENT,
    LINK,
    VIDEO,
    IMAGE,
    OTHER;

    /** Lowercase token used on the wire and in the database. */
    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire token, returning {@code null} for blank or unknown values.
     */
    public static ResourceType fromWire(String raw) {
        if (raw == null) {
            return null;
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (ResourceType type : values()) {
            if (type.wireValue().equals(wanted)) {
                return type;
            }
        }
        return null;
    }
}
