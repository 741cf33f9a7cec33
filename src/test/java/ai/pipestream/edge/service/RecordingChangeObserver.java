package ai.pipestream.edge.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects change events fired during a test.
 */
@ApplicationScoped
public class RecordingChangeObserver {

    private final List<EdgeChangeEvent> events = new CopyOnWriteArrayList<>();

    void onChange(@Observes EdgeChangeEvent event) {
        events.add(event);
    }

    public void clear() {
        events.clear();
    }

    public List<EdgeChangeEvent> ofType(EdgeChangeEvent.Type type) {
        List<EdgeChangeEvent> matching = new ArrayList<>();
        for (EdgeChangeEvent event : events) {
            if (event.type == type) {
                matching.add(event);
            }
        }
        return matching;
    }
}
