package chaosfuzz.runtime.scheduling;

import java.util.List;
import java.util.Objects;
import java.util.Random;

import chaosfuzz.model.TestCase;
import chaosfuzz.mutators.MutatorType;

/**
 * Picks every mutator with equal probability.
 */
public final class UniformRandomMutatorScheduler implements MutatorScheduler {

    private final List<MutatorType> mutatorTypes;

    public UniformRandomMutatorScheduler() {
        this(List.of(MutatorType.mutationCandidates()));
    }

    public UniformRandomMutatorScheduler(List<MutatorType> mutatorTypes) {
        if (mutatorTypes == null || mutatorTypes.isEmpty()) {
            throw new IllegalArgumentException("Mutator list must not be empty.");
        }
        this.mutatorTypes = List.copyOf(mutatorTypes);
    }

    @Override
    public MutatorType pickMutator(TestCase parent, Random random) {
        Objects.requireNonNull(parent, "parent");
        int idx = random.nextInt(mutatorTypes.size());
        return mutatorTypes.get(idx);
    }

    @Override
    public void recordMutationAttempt(MutatorType mutatorType, MutationAttemptStatus status) {
        // Uniform policy ignores feedback.
    }
}
