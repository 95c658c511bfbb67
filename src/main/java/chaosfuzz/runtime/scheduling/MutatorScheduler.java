package chaosfuzz.runtime.scheduling;

import java.util.Random;

import chaosfuzz.model.TestCase;
import chaosfuzz.mutators.MutatorType;

/**
 * Strategy interface that decides which mutator to apply next and ingests
 * feedback about each mutation round.
 */
public interface MutatorScheduler {

    /**
     * Pick the mutator for the next round on the given parent. Implementations
     * draw only from {@code random} so a seeded run stays reproducible.
     */
    MutatorType pickMutator(TestCase parent, Random random);

    /**
     * Notify the scheduler about the outcome of a mutation round.
     */
    void recordMutationAttempt(MutatorType mutatorType, MutationAttemptStatus status);

    enum MutationAttemptStatus {
        SUCCESS,
        NOT_APPLICABLE,
        FAILED
    }
}
