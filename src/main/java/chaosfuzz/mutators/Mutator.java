package chaosfuzz.mutators;

/**
 * One payload mutation round. Implementations work in place on the context's
 * buffer, which is always a private copy of the parent payload.
 */
public interface Mutator {
    MutationResult mutate(MutationContext ctx);
    boolean isApplicable(MutationContext ctx);
}
