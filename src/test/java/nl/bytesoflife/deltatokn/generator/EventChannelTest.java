package nl.bytesoflife.deltatokn.generator;

import nl.bytesoflife.deltatokn.generator.GenerationEvent.GenerationFailed;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class EventChannelTest {

    @Test
    void failingListenerDoesNotStopDelivery() {
        List<GenerationEvent> received = new ArrayList<>();
        EventChannel channel = new EventChannel()
                .subscribe(event -> {
                    throw new IllegalStateException("listener broke");
                })
                .subscribe(received::add);

        GenerationEvent event = new GenerationFailed("test");
        channel.publish(event);

        assertEquals(List.of(event), received);
    }

    @Test
    void unsubscribedListenerHearsNothing() {
        List<GenerationEvent> received = new ArrayList<>();
        Consumer<GenerationEvent> listener = received::add;
        EventChannel channel = new EventChannel().subscribe(listener);

        channel.unsubscribe(listener);
        channel.publish(new GenerationFailed("test"));

        assertTrue(received.isEmpty());
    }
}
