package chaosfuzz.model;

import java.time.Instant;
import java.util.Objects;

public record Alert(AlertLevel severity, String message, Instant timestamp) implements MonitorEvent {

    public Alert {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Alert critical(String message, Instant timestamp) {
        return new Alert(AlertLevel.CRITICAL, message, timestamp);
    }

    @Override
    public String eventType() {
        return "alert";
    }
}
