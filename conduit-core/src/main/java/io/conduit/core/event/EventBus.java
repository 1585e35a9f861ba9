package io.conduit.core.event;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Synchronous publish/subscribe channel for {@link PipelineEvent}s.
///
/// Subscribers registered through {@link #subscribeAll} receive every event,
/// before the subscribers registered for the event's own type. Within each
/// group delivery follows subscription order. {@link #emit} returns only after
/// every subscriber has returned.
///
/// ### Usage
/// {@snippet :
/// EventBus bus = new EventBus();
/// bus.subscribe(PipelineEvent.StageFailed.class, e -> alert(e.nodeId()));
/// bus.subscribeAll(new LoggingEventListener());
/// }
///
/// @implNote Thread-safe. A subscriber that throws is logged at WARNING and
/// does not stop delivery to the remaining subscribers.
public final class EventBus {

    private static final Logger logger = Logger.getLogger(EventBus.class.getName());

    private final List<Consumer<? super PipelineEvent>> global = new CopyOnWriteArrayList<>();
    private final Map<Class<?>, List<Consumer<? super PipelineEvent>>> typed =
            new ConcurrentHashMap<>();

    /// Subscribes to one event type.
    ///
    /// @param type event record class, not null
    /// @param subscriber callback, not null
    public <E extends PipelineEvent> void subscribe(Class<E> type, Consumer<? super E> subscriber) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        typed.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>())
                .add(event -> subscriber.accept(type.cast(event)));
    }

    /// Subscribes to every event.
    ///
    /// @param subscriber callback, not null
    public void subscribeAll(Consumer<? super PipelineEvent> subscriber) {
        global.add(Objects.requireNonNull(subscriber, "subscriber must not be null"));
    }

    /// Delivers an event to all matching subscribers.
    ///
    /// @param event the event, not null
    public void emit(PipelineEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        for (Consumer<? super PipelineEvent> subscriber : global) {
            deliver(subscriber, event);
        }
        List<Consumer<? super PipelineEvent>> forType = typed.get(event.getClass());
        if (forType != null) {
            for (Consumer<? super PipelineEvent> subscriber : forType) {
                deliver(subscriber, event);
            }
        }
    }

    private static void deliver(Consumer<? super PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Event subscriber failed on " + event, e);
        }
    }
}
