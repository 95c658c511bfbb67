package chaosfuzz.model;

import java.time.Instant;

/** Anything published to an event sink. */
public interface MonitorEvent {

    String eventType();

    Instant timestamp();
}
