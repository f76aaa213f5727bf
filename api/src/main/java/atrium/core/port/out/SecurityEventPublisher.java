package atrium.core.port.out;

import atrium.spi.SecurityEvent;

/**
 * Port interface for publishing security audit events.
 */
public interface SecurityEventPublisher {

    /**
     * Publish an event. Must not block the calling request thread.
     *
     * @param event the event
     */
    void publish(SecurityEvent event);
}
