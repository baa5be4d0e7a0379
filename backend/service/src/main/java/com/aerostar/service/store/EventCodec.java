package com.aerostar.service.store;

import com.aerostar.core.events.EnrichmentSkipped;
import com.aerostar.core.events.Event;
import com.aerostar.core.events.RecordsExcluded;
import com.aerostar.core.events.StageCompleted;
import com.aerostar.core.events.TransformCompleted;
import com.aerostar.core.events.TransformStarted;
import com.aerostar.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "TransformStarted", TransformStarted.class,
            "StageCompleted", StageCompleted.class,
            "RecordsExcluded", RecordsExcluded.class,
            "EnrichmentSkipped", EnrichmentSkipped.class,
            "TransformCompleted", TransformCompleted.class
    );

    private EventCodec() {
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

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
