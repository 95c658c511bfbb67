package chaosfuzz.model;

import java.util.Optional;

/**
 * Closed set of chaos test kinds. Each kind carries its default resource
 * profile and the monitor signal a crash of that kind feeds into.
 */
public enum TestKind {
    INSTRUCTION_FUZZ(1, 1, null, null),
    CONCURRENCY(2, 2, null, "concurrency"),
    FLASH_LOAN_PROBE(2, 4, null, "flash_loan"),
    STATE_CONSISTENCY(1, 2, ManipulationType.STATE, null),
    TIMELOCK_BYPASS(1, 1, ManipulationType.EXECUTION, null),
    QUORUM_MANIPULATION(1, 1, ManipulationType.VOTE, null),
    INSTRUCTION_INJECTION(1, 2, null, "instruction_injection");

    private final ResourceProfile defaultProfile;
    private final ManipulationType manipulationType;
    private final String exploitCategory;

    TestKind(long cpu, long mem, ManipulationType manipulationType, String exploitCategory) {
        this.defaultProfile = ResourceProfile.of(cpu, mem);
        this.manipulationType = manipulationType;
        this.exploitCategory = exploitCategory;
    }

    public ResourceProfile defaultProfile() {
        return defaultProfile;
    }

    public Optional<ManipulationType> manipulationType() {
        return Optional.ofNullable(manipulationType);
    }

    public Optional<String> exploitCategory() {
        return Optional.ofNullable(exploitCategory);
    }
}
