package chaosfuzz.security;

public enum CircuitBreakerState {
    CLOSED,
    OPEN
}
