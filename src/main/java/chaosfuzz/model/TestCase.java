package chaosfuzz.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/*
 * Immutable; mutation produces a new instance through mutated().
 */
public final class TestCase {
    private final String testCaseName;
    private final String parentName; // null for seeds
    private final TestKind kind;
    private final byte[] instructionPayload;
    private final List<AccountRef> targetAccounts;
    private final ExpectedResult expectedResult;
    private final ResourceProfile resourceProfile;
    private final int mutationDepth;

    public TestCase(String name,
                    TestKind kind,
                    byte[] instructionPayload,
                    List<AccountRef> targetAccounts,
                    ExpectedResult expectedResult,
                    ResourceProfile resourceProfile) {
        this(name, null, kind, instructionPayload, targetAccounts, expectedResult, resourceProfile, 0);
    }

    private TestCase(String name,
                     String parentName,
                     TestKind kind,
                     byte[] instructionPayload,
                     List<AccountRef> targetAccounts,
                     ExpectedResult expectedResult,
                     ResourceProfile resourceProfile,
                     int mutationDepth) {
        this.testCaseName = Objects.requireNonNull(name, "name");
        this.parentName = parentName;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.instructionPayload = Objects.requireNonNull(instructionPayload, "instructionPayload").clone();
        this.targetAccounts = List.copyOf(Objects.requireNonNull(targetAccounts, "targetAccounts"));
        this.expectedResult = Objects.requireNonNull(expectedResult, "expectedResult");
        this.resourceProfile = resourceProfile != null ? resourceProfile : kind.defaultProfile();
        this.mutationDepth = mutationDepth;
    }

    /** Seed test case of the given kind, using the kind's default resource profile. */
    public static TestCase of(String name, TestKind kind, byte[] payload, List<AccountRef> accounts, ExpectedResult expected) {
        return new TestCase(name, kind, payload, accounts, expected, null);
    }

    /**
     * Child of this test case carrying the given payload and accounts. The
     * expectation, kind and resource profile are inherited.
     */
    public TestCase mutated(byte[] payload, List<AccountRef> accounts) {
        int depth = mutationDepth + 1;
        return new TestCase(testCaseName + "~m" + depth, testCaseName, kind, payload, accounts,
                expectedResult, resourceProfile, depth);
    }

    /** Unmodified copy that still records this case as its parent. */
    public TestCase copy() {
        return new TestCase(testCaseName, parentName, kind, instructionPayload, targetAccounts,
                expectedResult, resourceProfile, mutationDepth);
    }

    public String getName() {
        return testCaseName;
    }

    public String getParentName() {
        return parentName;
    }

    public TestKind getKind() {
        return kind;
    }

    /** Returns a copy; the stored payload never changes. */
    public byte[] getPayload() {
        return instructionPayload.clone();
    }

    public int getPayloadLength() {
        return instructionPayload.length;
    }

    public List<AccountRef> getAccounts() {
        return targetAccounts;
    }

    public ExpectedResult getExpectedResult() {
        return expectedResult;
    }

    public ResourceProfile getResourceProfile() {
        return resourceProfile;
    }

    public int getMutationDepth() {
        return mutationDepth;
    }

    public boolean hasSamePayload(byte[] other) {
        return Arrays.equals(instructionPayload, other);
    }

    @Override
    public String toString() {
        return String.format("TestCase[%s, kind=%s, payload=%d bytes, accounts=%d, expected=%s]",
                testCaseName, kind, instructionPayload.length, targetAccounts.size(), expectedResult);
    }
}
