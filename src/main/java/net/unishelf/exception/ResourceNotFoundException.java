package net.unishelf.exception;

import java.util.UUID;

public class ResourceNotFoundException extends RuntimeException {

    private final UUID resourceId;

    public ResourceNotFoundException(UUID resourceId) {
        super("Resource not found: " + resourceId);
        this.resourceId = resourceId;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
