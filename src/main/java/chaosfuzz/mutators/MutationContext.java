package chaosfuzz.mutators;

import java.util.Random;

import chaosfuzz.model.TestCase;

public class MutationContext {
    private final Random rng;
    private final TestCase parentCase;
    private final byte[] payload;
    private final int targetIndex;

    public MutationContext(Random rng, TestCase parentCase, byte[] payload, int targetIndex) {
        this.rng = rng;
        this.parentCase = parentCase;
        this.payload = payload;
        this.targetIndex = targetIndex;
    }

    public Random rng() {
        return rng;
    }

    public TestCase parentCase() {
        return parentCase;
    }

    /** Working buffer shared by all rounds of one mutation call. */
    public byte[] payload() {
        return payload;
    }

    /** Byte index chosen for this round; -1 when the payload is empty. */
    public int targetIndex() {
        return targetIndex;
    }

    public boolean hasTarget() {
        return targetIndex >= 0 && targetIndex < payload.length;
    }
}
