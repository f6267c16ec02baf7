package net.unishelf.application.resource;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published after a resource was shared with a study group or a list of users.
 * Message delivery listens for it; this service only records the share.
 */
public record ResourceSharedEvent(
    UUID resourceId,
    String resourceTitle,
    String sharedBy,
    String groupId,
    List<String> recipientUserIds,
    String message,
    Instant sharedAt
) {

    public ResourceSharedEvent {
        recipientUserIds = recipientUserIds == null ? List.of() : List.copyOf(recipientUserIds);
    }
}
