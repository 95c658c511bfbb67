package chaosfuzz.io;

import java.util.logging.Level;
import java.util.logging.Logger;

import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.Alert;
import chaosfuzz.model.AlertLevel;
import chaosfuzz.model.Finding;
import chaosfuzz.model.FindingSeverity;
import chaosfuzz.model.MonitorEvent;

/** Writes every event to the log, mapped onto JUL levels. */
public final class LoggingEventSink implements EventSink {
    private static final Logger LOGGER = LoggingConfig.getLogger(LoggingEventSink.class);

    @Override
    public void record(MonitorEvent event) {
        if (event instanceof Alert alert) {
            LOGGER.log(levelFor(alert.severity()), String.format("ALERT [%s] %s",
                    alert.severity(), alert.message()));
        } else if (event instanceof Finding finding) {
            LOGGER.log(levelFor(finding.severity()), String.format("Finding [%s/%s] test=%s: %s %s",
                    finding.severity(), finding.category(), finding.relatedTestId(),
                    finding.description(), finding.metadata().isEmpty() ? "" : finding.metadata()));
        } else {
            LOGGER.info(String.format("Event %s at %s", event.eventType(), event.timestamp()));
        }
    }

    static Level levelFor(AlertLevel level) {
        switch (level) {
            case CRITICAL:
                return Level.SEVERE;
            case WARNING:
                return Level.WARNING;
            default:
                return Level.INFO;
        }
    }

    static Level levelFor(FindingSeverity severity) {
        switch (severity) {
            case CRITICAL:
            case HIGH:
                return Level.WARNING;
            case MEDIUM:
                return Level.INFO;
            default:
                return Level.FINE;
        }
    }
}
