package dumb.prodsys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Synchronous listener registry; listeners run on the caller's thread, in registration order.
 */
public class Events {
    private static final Logger logger = LoggerFactory.getLogger(Events.class);

    private final Map<Class<? extends Event>, List<Consumer<Event>>> listeners = new HashMap<>();

    private static void exeSafe(Consumer<Event> listener, Event event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            logger.error("Error processing event listener for {}: {}", event.getEventType(), e.getMessage(), e);
        }
    }

    public <T extends Event> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new ArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(Event event) {
        listeners.getOrDefault(event.getClass(), List.of()).forEach(listener -> exeSafe(listener, event));
    }
}
