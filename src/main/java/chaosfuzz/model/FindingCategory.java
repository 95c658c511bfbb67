package chaosfuzz.model;

public enum FindingCategory {
    SECURITY_VULNERABILITY,
    PERFORMANCE_ISSUE,
    DATA_INCONSISTENCY,
    CONCURRENCY_ISSUE,
    LOGIC_ERROR,
    RESOURCE_EXHAUSTION,
    UNAUTHORIZED_ACCESS,
    STATE_MANIPULATION
}
