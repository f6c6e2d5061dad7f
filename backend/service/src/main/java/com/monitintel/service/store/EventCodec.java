package com.monitintel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.AnalysisHandedOff;
import com.monitintel.core.events.CycleCompleted;
import com.monitintel.core.events.CycleSkipped;
import com.monitintel.core.events.CycleStarted;
import com.monitintel.core.events.Event;
import com.monitintel.core.events.FailureClassified;
import com.monitintel.core.events.RetentionSwept;
import com.monitintel.core.events.SnapshotsIngested;
import com.monitintel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One journal line per event: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = types();

    private EventCodec() {
    }

    private static Map<String, Class<? extends Event>> types() {
        Map<String, Class<? extends Event>> types = new LinkedHashMap<>();
        types.put("CycleStarted", CycleStarted.class);
        types.put("CycleCompleted", CycleCompleted.class);
        types.put("CycleSkipped", CycleSkipped.class);
        types.put("SnapshotsIngested", SnapshotsIngested.class);
        types.put("RetentionSwept", RetentionSwept.class);
        types.put("FailureClassified", FailureClassified.class);
        types.put("AnalysisHandedOff", AnalysisHandedOff.class);
        types.put("AlertRaised", AlertRaised.class);
        return Map.copyOf(types);
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(allEventTypes(), consumer);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
