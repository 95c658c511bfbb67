package chaosfuzz.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.MonitorEvent;

/**
 * Appends one JSON object per event to a file:
 * {@code {"type":"finding","event":{...}}}.
 */
public final class JsonLinesEventSink implements EventSink {
    private static final Logger LOGGER = LoggingConfig.getLogger(JsonLinesEventSink.class);

    private final Path file;

    public JsonLinesEventSink(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event log: " + file, e);
        }
    }

    @Override
    public synchronized void record(MonitorEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", event.eventType());
        row.put("event", event);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOGGER.warning(String.format("Failed to append %s event to %s: %s",
                    event.eventType(), file, e.getMessage()));
        }
    }

    public Path file() {
        return file;
    }
}
