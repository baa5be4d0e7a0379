package com.aerostar.core.bus;

import com.aerostar.core.events.Event;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process bus. Handlers run on the publishing thread in subscription order.
 * A handler registered for a supertype (for example {@link Event}) receives every subtype.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> subscribers = new LinkedHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<? super T> handler) {
        Consumer<? super Event> filtered = event -> handler.accept(type.cast(event));
        subscribers.computeIfAbsent(type, ignored -> new ArrayList<>()).add(filtered);
    }

    public void publish(Event event) {
        for (Map.Entry<Class<? extends Event>, List<Consumer<? super Event>>> entry : subscribers.entrySet()) {
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (Consumer<? super Event> handler : List.copyOf(entry.getValue())) {
                try {
                    handler.accept(event);
                } catch (Exception ex) {
                    onHandlerError.accept(event, ex);
                }
            }
        }
    }
}
