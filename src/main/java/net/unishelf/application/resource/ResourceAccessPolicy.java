package net.unishelf.application.resource;

import jakarta.annotation.Nullable;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.resource.Resource;

/**
 * Decides whether a caller may see a resource's detail or download it.
 * Search results are not filtered by this policy, only by approval.
 */
public interface ResourceAccessPolicy {

    /**
     * @param caller authenticated caller, or {@code null} for an anonymous request
     */
    boolean canAccess(@Nullable CallerIdentity caller, Resource resource);
}
