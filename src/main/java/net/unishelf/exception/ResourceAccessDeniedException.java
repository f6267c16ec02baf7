package net.unishelf.exception;

import java.util.UUID;

/**
 * The access policy refused the caller for this resource.
 */
public class ResourceAccessDeniedException extends RuntimeException {
    public ResourceAccessDeniedException(UUID resourceId) {
        super("You do not have permission to access resource " + resourceId);
    }
}
