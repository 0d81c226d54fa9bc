package com.iocguardian.indicators.module;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record extracted from a device artifact.
 *
 * @param timestamp when the recorded event happened
 * @param fields    module-specific values, in extraction order
 *
 * @author IOC Guardian Developers
 */
public record ArtifactRecord(Instant timestamp, Map<String, Object> fields) {

    public ArtifactRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name) {
        Object value = fields.get(name);
        return value != null ? value.toString() : null;
    }
}
