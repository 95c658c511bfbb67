package chaosfuzz.model;

public enum ManipulationType {
    VOTE,
    EXECUTION,
    STATE
}
