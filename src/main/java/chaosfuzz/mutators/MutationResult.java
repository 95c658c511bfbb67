package chaosfuzz.mutators;

public record MutationResult(MutationStatus status, String detail) {

    public static MutationResult success() {
        return new MutationResult(MutationStatus.SUCCESS, "");
    }

    public static MutationResult skipped(String detail) {
        return new MutationResult(MutationStatus.SKIPPED, detail);
    }
}
