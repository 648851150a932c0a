package taskescrow.registry.core;

import taskescrow.registry.model.TaskEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous fan-out of registry notifications to external consumers (indexers, UIs).
 * Events of one operation are delivered in emission order. A failing listener is logged
 * and does not stop delivery to the others.
 */
public final class TaskEventBus {

    private static final Logger log = LoggerFactory.getLogger(TaskEventBus.class);

    private final CopyOnWriteArrayList<Consumer<TaskEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<TaskEvent> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Consumer<TaskEvent> listener) {
        listeners.remove(listener);
    }

    public void publish(List<TaskEvent> events) {
        for (TaskEvent event : events) {
            log.info("event {}", event);
            for (var listener : listeners) {
                try {
                    listener.accept(event);
                } catch (RuntimeException e) {
                    log.error("Listener failed on {}: {}", event, e.getMessage(), e);
                }
            }
        }
    }
}
