package chaosfuzz.mutators;

public enum MutatorType {
    BIT_FLIP,
    BYTE_REPEAT,
    BYTE_NULL,
    BYTE_RANDOM;

    private static final MutatorType[] MUTATION_CANDIDATES = values();

    public static MutatorType[] mutationCandidates() {
        return MUTATION_CANDIDATES.clone();
    }
}
