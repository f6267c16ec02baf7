package net.unishelf.application.resource;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.caller.CallerRole;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.Resource;
import net.unishelf.testutil.ResourceTestData;
import org.junit.jupiter.api.Test;

class DefaultResourceAccessPolicyTest {

    private final DefaultResourceAccessPolicy policy = new DefaultResourceAccessPolicy();

    private static Resource resource(AccessLevel level) {
        return ResourceTestData.aResource()
            .accessLevel(level)
            .uploaderId("owner")
            .departmentIds(List.of("CS"))
            .courseIds(List.of("CS101"))
            .build();
    }

    private static CallerIdentity student(List<String> departments, List<String> courses) {
        return new CallerIdentity("stud-9", CallerRole.STUDENT, departments, courses);
    }

    @Test
    void publicResource_OpenToAnonymousCallers() {
        assertThat(policy.canAccess(null, resource(AccessLevel.PUBLIC))).isTrue();
    }

    @Test
    void restrictedResource_ClosedToAnonymousCallers() {
        assertThat(policy.canAccess(null, resource(AccessLevel.DEPARTMENT))).isFalse();
    }

    @Test
    void departmentResource_RequiresSharedDepartment() {
        assertThat(policy.canAccess(student(List.of("CS"), List.of()), resource(AccessLevel.DEPARTMENT))).isTrue();
        assertThat(policy.canAccess(student(List.of("MATH"), List.of("CS101")), resource(AccessLevel.DEPARTMENT))).isFalse();
    }

    @Test
    void courseResource_RequiresSharedCourse() {
        assertThat(policy.canAccess(student(List.of(), List.of("CS101")), resource(AccessLevel.COURSE))).isTrue();
        assertThat(policy.canAccess(student(List.of("CS"), List.of("CS202")), resource(AccessLevel.COURSE))).isFalse();
    }

    @Test
    void privateResource_OnlyUploaderAndAdmins() {
        Resource privateResource = resource(AccessLevel.PRIVATE);

        assertThat(policy.canAccess(ResourceTestData.student("owner"), privateResource)).isTrue();
        assertThat(policy.canAccess(ResourceTestData.admin("root"), privateResource)).isTrue();
        assertThat(policy.canAccess(ResourceTestData.lecturer("lect-1"), privateResource)).isFalse();
    }
}
