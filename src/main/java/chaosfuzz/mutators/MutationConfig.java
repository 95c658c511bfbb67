package chaosfuzz.mutators;

/**
 * @param mutationRate  probability in [0,1] that the payload is mutated at all
 * @param intensity     number of rounds applied when it is
 * @param mutateAccounts whether the account-flag axis runs once per call
 */
public record MutationConfig(double mutationRate, int intensity, boolean mutateAccounts) {

    public MutationConfig {
        if (Double.isNaN(mutationRate) || mutationRate < 0.0 || mutationRate > 1.0) {
            throw new IllegalArgumentException("Mutation rate must be within [0,1]: " + mutationRate);
        }
        if (intensity < 0) {
            throw new IllegalArgumentException("Mutation intensity must not be negative: " + intensity);
        }
    }

    public MutationConfig(double mutationRate, int intensity) {
        this(mutationRate, intensity, true);
    }
}
