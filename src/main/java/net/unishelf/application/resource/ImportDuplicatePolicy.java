package net.unishelf.application.resource;

import java.util.Optional;

/**
 * What importing an already imported (source, external id) pair does.
 */
public enum ImportDuplicatePolicy {
    /** Return the earlier import unchanged. */
    REUSE_EXISTING,
    /** Insert a fresh local copy every time. */
    ALWAYS_CREATE;

    /**
     * Reads the {@code app.import.duplicate-policy} value. Case is ignored and
     * hyphens stand for underscores, so {@code always-create} is accepted.
     */
    public static Optional<ImportDuplicatePolicy> fromProperty(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String wanted = raw.trim().replace('-', '_');
        for (ImportDuplicatePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(wanted)) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }
}
