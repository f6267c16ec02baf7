package net.unishelf.application.resource;

/**
 * Outbound port for telling recipients that a resource was shared with them.
 */
public interface ResourceShareNotifier {

    void notifyShared(ResourceSharedEvent event);
}
