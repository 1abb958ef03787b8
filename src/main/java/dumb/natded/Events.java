package dumb.natded;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static dumb.natded.Log.error;

/**
 * Synchronous listener registry for {@link CheckEvent}s. Listeners run on the checking thread, in
 * registration order; one registered for a supertype sees every subtype.
 */
public class Events {
    private final Map<Class<? extends CheckEvent>, List<Consumer<CheckEvent>>> listeners = new LinkedHashMap<>();

    private static void exeSafe(Consumer<CheckEvent> listener, CheckEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            error("Error processing event listener for " + event.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public <T extends CheckEvent> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new ArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(CheckEvent event) {
        listeners.forEach((type, ls) -> {
            if (type.isInstance(event)) ls.forEach(l -> exeSafe(l, event));
        });
    }
}
