package chaosfuzz.support;

import java.util.ArrayList;
import java.util.List;

import chaosfuzz.model.AccountRef;
import chaosfuzz.model.ExpectedResult;
import chaosfuzz.model.ResourceProfile;
import chaosfuzz.model.TestCase;
import chaosfuzz.model.TestKind;

public final class TestCases {

    public static final String SYSTEM_PROGRAM = "11111111111111111111111111111111";
    public static final String TOKEN_PROGRAM = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";

    private TestCases() {
    }

    public static List<AccountRef> accounts() {
        return List.of(
                new AccountRef(SYSTEM_PROGRAM, true, false),
                new AccountRef(TOKEN_PROGRAM, false, true));
    }

    public static TestCase simple(String name, ResourceProfile profile) {
        return new TestCase(name, TestKind.INSTRUCTION_FUZZ, new byte[] {1, 2, 3, 4}, accounts(),
                ExpectedResult.success(), profile);
    }

    public static TestCase withPayload(String name, byte[] payload) {
        return new TestCase(name, TestKind.INSTRUCTION_FUZZ, payload, accounts(),
                ExpectedResult.success(), ResourceProfile.of(1, 1));
    }

    public static List<TestCase> batch(int count, ResourceProfile profile) {
        List<TestCase> cases = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            cases.add(simple("case-" + i, profile));
        }
        return cases;
    }
}
