package chaosfuzz.io;

import java.util.List;

import chaosfuzz.model.MonitorEvent;

/**
 * Fire-and-forget destination for findings and alerts. Implementations must
 * not throw: delivery problems are logged and dropped.
 */
@FunctionalInterface
public interface EventSink {

    void record(MonitorEvent event);

    static EventSink composite(List<EventSink> sinks) {
        List<EventSink> copy = List.copyOf(sinks);
        return event -> {
            for (EventSink sink : copy) {
                sink.record(event);
            }
        };
    }

    static EventSink discarding() {
        return event -> { };
    }
}
