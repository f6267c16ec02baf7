package net.unishelf.domain.caller;

public enum CallerRole {
    STUDENT,
    LECTURER,
    ADMIN;

    /** Lecturers and admins; their uploads and imports are approved on creation. */
    public boolean isStaff() {
        return this == LECTURER || this == ADMIN;
    }

    public static CallerRole fromHeader(String raw) {
        if (raw == null) {
            return STUDENT;
        }
        String wanted = raw.trim();
        for (CallerRole role : values()) {
            if (role.name().equalsIgnoreCase(wanted)) {
                return role;
            }
        }
        return STUDENT;
    }
}
