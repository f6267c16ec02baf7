package net.unishelf.application.resource;

import java.util.List;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.CandidateRecord;

/**
 * Request to promote an external candidate into the local store.
 */
public record ResourceImportCommand(
    CandidateRecord candidate,
    CallerIdentity importer,
    AccessLevel accessLevel,
    List<String> departmentIds,
    List<String> courseIds
) {

    public ResourceImportCommand {
        accessLevel = accessLevel == null ? AccessLevel.PUBLIC : accessLevel;
        departmentIds = departmentIds == null ? List.of() : List.copyOf(departmentIds);
        courseIds = courseIds == null ? List.of() : List.copyOf(courseIds);
    }
}
