package chaosfuzz.mutators;

/** Copies the previous byte into the target position. Nothing to copy at index 0. */
public class ByteRepeatMutator implements Mutator {

    @Override
    public MutationResult mutate(MutationContext ctx) {
        if (!isApplicable(ctx)) {
            return MutationResult.skipped("No preceding byte for ByteRepeatMutator");
        }
        byte[] payload = ctx.payload();
        int idx = ctx.targetIndex();
        payload[idx] = payload[idx - 1];
        return MutationResult.success();
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.hasTarget() && ctx.targetIndex() > 0;
    }
}
