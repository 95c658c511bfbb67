package chaosfuzz.model;

public record TestMetrics(long computeUnits, long memoryBytes, long executionTimeMillis) {

    public static final TestMetrics NONE = new TestMetrics(0L, 0L, 0L);
}
