package net.unishelf.application.resource;

import java.util.Collection;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.Resource;
import org.springframework.stereotype.Component;

/**
 * Access rules by visibility level. Admins and the uploader always pass; public
 * resources are open to everyone including anonymous callers.
 */
@Component
public class DefaultResourceAccessPolicy implements ResourceAccessPolicy {

    @Override
    public boolean canAccess(CallerIdentity caller, Resource resource) {
        if (resource.accessLevel() == null) {
            return false;
        }
        if (resource.accessLevel() == AccessLevel.PUBLIC) {
            return true;
        }
        if (caller == null) {
            return false;
        }
        if (caller.isAdmin() || caller.userId().equals(resource.uploaderId())) {
            return true;
        }
        return switch (resource.accessLevel()) {
            case DEPARTMENT -> overlaps(caller.departmentIds(), resource.departmentIds());
            case COURSE -> overlaps(caller.courseIds(), resource.courseIds());
            case PRIVATE, PUBLIC -> false;
        };
    }

    private static boolean overlaps(Collection<String> callerIds, Collection<String> resourceIds) {
        for (String id : callerIds) {
            if (resourceIds.contains(id)) {
                return true;
            }
        }
        return false;
    }
}
