package chaosfuzz.model;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * What a test case expects the target program to do: succeed, fail with a
 * specific error code, or revert with any error.
 */
public final class ExpectedResult {

    public enum Kind {
        SUCCESS,
        FAIL_WITH,
        REVERT
    }

    private static final ExpectedResult SUCCESS = new ExpectedResult(Kind.SUCCESS, 0);
    private static final ExpectedResult REVERT = new ExpectedResult(Kind.REVERT, 0);

    private final Kind kind;
    private final int code;

    private ExpectedResult(Kind kind, int code) {
        this.kind = kind;
        this.code = code;
    }

    public static ExpectedResult success() {
        return SUCCESS;
    }

    public static ExpectedResult revert() {
        return REVERT;
    }

    public static ExpectedResult failWith(int code) {
        return new ExpectedResult(Kind.FAIL_WITH, code);
    }

    public Kind kind() {
        return kind;
    }

    /** Expected error code; only present for {@link Kind#FAIL_WITH}. */
    public OptionalInt code() {
        return kind == Kind.FAIL_WITH ? OptionalInt.of(code) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpectedResult other)) {
            return false;
        }
        return kind == other.kind && code == other.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, code);
    }

    @Override
    public String toString() {
        return kind == Kind.FAIL_WITH ? "FailWith(" + code + ")" : kind.name();
    }
}
