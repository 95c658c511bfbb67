package chaosfuzz.mutators;

public enum MutationStatus {
    SUCCESS,
    SKIPPED,
    FAILED
}
