package nl.bytesoflife.deltatokn.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers {@link GenerationEvent}s to subscribers on the publishing thread, in subscription
 * order. A listener that throws is logged and does not stop delivery to the others.
 */
public class EventChannel {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    private final List<Consumer<? super GenerationEvent>> listeners = new CopyOnWriteArrayList<>();

    public EventChannel subscribe(Consumer<? super GenerationEvent> listener) {
        listeners.add(listener);
        return this;
    }

    public void unsubscribe(Consumer<? super GenerationEvent> listener) {
        listeners.remove(listener);
    }

    public void publish(GenerationEvent event) {
        for (Consumer<? super GenerationEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}", event, e);
            }
        }
    }
}
