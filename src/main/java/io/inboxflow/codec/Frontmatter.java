package io.inboxflow.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Frontmatter(Map<String, Object> fields, String body) {
    public Frontmatter {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        body = body == null ? "" : body;
    }

    public boolean hasHeader() {
        return !fields.isEmpty();
    }
}
