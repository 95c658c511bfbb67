package chaosfuzz.mutators;

public class ByteNullMutator implements Mutator {

    @Override
    public MutationResult mutate(MutationContext ctx) {
        if (!isApplicable(ctx)) {
            return MutationResult.skipped("Empty payload for ByteNullMutator");
        }
        ctx.payload()[ctx.targetIndex()] = 0;
        return MutationResult.success();
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.hasTarget();
    }
}
