package dumb.natded;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventsTest {

    @Test
    void supertypeListenerSeesSubtypes() {
        var bus = new Events();
        var all = new ArrayList<CheckEvent>();
        var finished = new ArrayList<CheckEvent.CheckFinished>();
        bus.on(CheckEvent.class, all::add);
        bus.on(CheckEvent.CheckFinished.class, finished::add);

        bus.emit(new CheckEvent.CheckFinished(true, 3));
        bus.emit(new CheckEvent.LineChecked(1, "A", "prem"));

        assertEquals(2, all.size());
        assertEquals(List.of(new CheckEvent.CheckFinished(true, 3)), finished);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var bus = new Events();
        var seen = new ArrayList<CheckEvent>();
        bus.on(CheckEvent.class, e -> {
            throw new IllegalStateException("boom");
        });
        bus.on(CheckEvent.class, seen::add);

        bus.emit(new CheckEvent.CheckFinished(false, 0));
        assertEquals(1, seen.size());
    }

    @Test
    void eventsSerializeWithTheirType() {
        var json = new CheckEvent.CheckFinished(true, 2).toJson();
        assertEquals("CheckFinished", json.get("eventType").asText());
        assertTrue(json.get("verified").asBoolean());
    }
}
