package chaosfuzz.mutators;

/** Overwrites the target byte with a uniformly random value. */
public class ByteRandomMutator implements Mutator {

    @Override
    public MutationResult mutate(MutationContext ctx) {
        if (!isApplicable(ctx)) {
            return MutationResult.skipped("Empty payload for ByteRandomMutator");
        }
        ctx.payload()[ctx.targetIndex()] = (byte) ctx.rng().nextInt(256);
        return MutationResult.success();
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.hasTarget();
    }
}
