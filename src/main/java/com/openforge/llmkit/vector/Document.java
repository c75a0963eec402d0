package com.openforge.llmkit.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored document as returned by a similarity query.
 * Text documents keep their body under the "content" metadata key.
 */
public record Document(
        String id,
        Map<String, Object> metadata
) {

    public static final String CONTENT_KEY = "content";

    public Document {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** The "content" metadata value when it is a string, otherwise null. */
    public String content() {
        Object value = metadata.get(CONTENT_KEY);
        return value instanceof String s ? s : null;
    }
}
