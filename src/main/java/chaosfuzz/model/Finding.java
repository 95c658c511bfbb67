package chaosfuzz.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recorded anomaly. Immutable once built; {@link #withMetadata} returns a copy.
 */
public record Finding(
        FindingCategory category,
        FindingSeverity severity,
        String description,
        Instant timestamp,
        String relatedTestId,
        Map<String, String> metadata) implements MonitorEvent {

    public Finding {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Finding of(FindingCategory category, FindingSeverity severity, String description,
                             Instant timestamp, String relatedTestId) {
        return new Finding(category, severity, description, timestamp, relatedTestId, Map.of());
    }

    public Finding withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Finding(category, severity, description, timestamp, relatedTestId, copy);
    }

    @Override
    public String eventType() {
        return "finding";
    }
}
