package chaosfuzz.io;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import chaosfuzz.model.Alert;
import chaosfuzz.model.Finding;
import chaosfuzz.model.FindingCategory;
import chaosfuzz.model.FindingSeverity;
import chaosfuzz.model.MonitorEvent;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonLinesEventSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void eachEventShouldBecomeOneJsonLine() throws Exception {
        Path file = tempDir.resolve("nested").resolve("events.ndjson");
        JsonLinesEventSink sink = new JsonLinesEventSink(file);
        Instant ts = Instant.parse("2024-01-01T00:00:00Z");

        sink.record(Finding.of(FindingCategory.LOGIC_ERROR, FindingSeverity.HIGH, "boom", ts, "case-1")
                .withMetadata("metric", "compute_units"));
        sink.record(Alert.critical("breaker open", ts));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());

        JsonNode finding = Jsons.mapper().readTree(lines.get(0));
        assertEquals("finding", finding.path("type").asText());
        assertEquals("LOGIC_ERROR", finding.path("event").path("category").asText());
        assertEquals("case-1", finding.path("event").path("relatedTestId").asText());
        assertEquals("2024-01-01T00:00:00Z", finding.path("event").path("timestamp").asText());
        assertEquals("compute_units", finding.path("event").path("metadata").path("metric").asText());

        JsonNode alert = Jsons.mapper().readTree(lines.get(1));
        assertEquals("alert", alert.path("type").asText());
        assertEquals("CRITICAL", alert.path("event").path("severity").asText());
    }

    @Test
    void compositeShouldFanOutInOrder() {
        List<String> seen = new ArrayList<>();
        EventSink first = event -> seen.add("first:" + event.eventType());
        EventSink second = event -> seen.add("second:" + event.eventType());
        MonitorEvent alert = Alert.critical("x", Instant.EPOCH);

        EventSink.composite(List.of(first, second, EventSink.discarding())).record(alert);

        assertEquals(List.of("first:alert", "second:alert"), seen);
    }
}
