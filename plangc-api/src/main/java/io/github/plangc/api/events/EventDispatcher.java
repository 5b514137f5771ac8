package io.github.plangc.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something compiler events can be listened to on.
 *
 * @param <S> The common supertype of the events.
 */
public interface EventDispatcher<S> {
    /**
     * Add a listener for one event type.
     * <p>
     * Listeners match on the exact class the event is dispatched as; listening to
     * a supertype does not see subtype events.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     * @return A handle that removes the listener again when run.
     */
    <T extends S> Runnable listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
