package net.unishelf.application.resource;

import net.unishelf.domain.resource.Resource;

/**
 * @param created {@code false} when an earlier import was reused
 */
public record ResourceImportResult(Resource resource, boolean created) {
}
