package chaosfuzz.mutators;

/** Flips one random bit of the target byte. */
public class BitFlipMutator implements Mutator {

    @Override
    public MutationResult mutate(MutationContext ctx) {
        if (!isApplicable(ctx)) {
            return MutationResult.skipped("Empty payload for BitFlipMutator");
        }
        int bit = ctx.rng().nextInt(8);
        byte[] payload = ctx.payload();
        payload[ctx.targetIndex()] ^= (byte) (1 << bit);
        return MutationResult.success();
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.hasTarget();
    }
}
