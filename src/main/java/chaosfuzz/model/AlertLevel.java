package chaosfuzz.model;

public enum AlertLevel {
    INFO,
    WARNING,
    CRITICAL
}
