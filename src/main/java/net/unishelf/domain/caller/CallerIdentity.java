package net.unishelf.domain.caller;

import java.util.List;

/**
 * Authenticated caller as asserted by the gateway in front of this service.
 */
public record CallerIdentity(
    String userId,
    CallerRole role,
    List<String> departmentIds,
    List<String> courseIds
) {

    public CallerIdentity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        role = role == null ? CallerRole.STUDENT : role;
        departmentIds = departmentIds == null ? List.of() : List.copyOf(departmentIds);
        courseIds = courseIds == null ? List.of() : List.copyOf(courseIds);
    }

    public boolean isStaff() {
        return role.isStaff();
    }

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }
}
