package com.monitintel.core.bus;

import com.monitintel.core.events.Event;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process dispatch of cycle events. Handlers run on the publishing thread; a
 * failing handler never stops delivery to the others.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> subscribers =
            new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler failed for " + event.type() + " event", ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void subscribeAll(Collection<Class<? extends Event>> types, Consumer<Event> handler) {
        for (Class<? extends Event> type : types) {
            subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
        }
    }

    public void publish(Event event) {
        List<Consumer<? extends Event>> handlers = subscribers.getOrDefault(event.getClass(), List.of());
        for (Consumer<? extends Event> rawHandler : handlers) {
            deliver(rawHandler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void deliver(Consumer<? extends Event> rawHandler, Event event) {
        try {
            ((Consumer<T>) rawHandler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
