package com.narrative.sge.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named game event raised by an Event or Audio node.
 *
 * @param name         event name chosen by the author
 * @param category     free-form grouping, e.g. "quest" or "audio"
 * @param sourceNodeId id of the node that raised the event
 * @param parameters   resolved parameter values; a value is null when it
 *                     referenced a missing variable
 */
public record StoryEvent(String name, String category, String sourceNodeId, Map<String, Object> parameters) {

    public StoryEvent {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
