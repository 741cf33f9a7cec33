package ai.pipestream.edge.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Fans committed changes out to CDI observers (topic-style notifications for mirror updates,
 * ready views and document changes).
 */
@ApplicationScoped
public class ChangeEventPublisher {

    private static final Logger LOG = Logger.getLogger(ChangeEventPublisher.class);

    @Inject
    Event<EdgeChangeEvent> events;

    /**
     * Fire an event. Must be called after the change has committed. Observer failures are logged
     * and not propagated, since the change itself is already durable.
     */
    public void publish(EdgeChangeEvent event) {
        LOG.debugf("Publishing change event %s", event);
        try {
            events.fire(event);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Change event observer failed for %s", event);
        }
    }
}
