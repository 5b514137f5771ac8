package io.github.plangc.api.events;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An {@link EventDispatcher} that can also fire its events.
 * <p>
 * Listeners run synchronously on the dispatching thread, in the order they were added.
 * Adding or removing listeners while an event is being dispatched is safe; the change
 * applies from the next dispatch.
 *
 * @param <S> The common supertype of the events.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private static final Logger LOG = LoggerFactory.getLogger(EventSupplier.class);

    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> Runnable listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        List<Consumer<?>> forClass = listeners.computeIfAbsent(eventClass, k -> new CopyOnWriteArrayList<>());
        forClass.add(listener);
        return () -> forClass.remove(listener);
    }

    /**
     * Check whether anything listens to an event type.
     *
     * @param eventClass The event class.
     * @return Whether a dispatch of that class would reach a listener.
     */
    public boolean hasListeners(Class<? extends S> eventClass) {
        List<Consumer<?>> forClass = listeners.get(eventClass);
        return forClass != null && !forClass.isEmpty();
    }

    /**
     * Fire an event at the listeners of its class.
     * <p>
     * A listener that throws stops the dispatch; the exception propagates with
     * the event class attached as a suppressed exception.
     *
     * @param eventClass The class to dispatch the event as.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, as the listeners left it.
     */
    @SuppressWarnings("unchecked")
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        List<Consumer<?>> forClass = listeners.get(eventClass);
        if (forClass == null) return event;
        LOG.trace("Dispatching {} to {} listener(s)", eventClass.getSimpleName(), forClass.size());
        for (Consumer<?> listener : forClass) {
            try {
                ((Consumer<T>) listener).accept(event);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("in listener for " + eventClass.getSimpleName()));
                throw e;
            }
        }
        return event;
    }
}
