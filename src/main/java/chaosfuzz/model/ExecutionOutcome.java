package chaosfuzz.model;

public enum ExecutionOutcome {
    OK,
    CRASH
}
