package net.unishelf.application.resource;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Default share notifier: publishes a {@link ResourceSharedEvent} on the application
 * event bus for whichever messaging component is listening.
 */
@Slf4j
@Component
public class EventPublishingResourceShareNotifier implements ResourceShareNotifier {

    private final ApplicationEventPublisher eventPublisher;

    public EventPublishingResourceShareNotifier(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void notifyShared(ResourceSharedEvent event) {
        log.info("Resource {} shared by {} (group={}, recipients={})",
            event.resourceId(), event.sharedBy(), event.groupId(), event.recipientUserIds().size());
        eventPublisher.publishEvent(event);
    }
}
