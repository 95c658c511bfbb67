package chaosfuzz.runtime;

import chaosfuzz.model.ResourceProfile;

public class InsufficientCapacityException extends AdmissionException {

    private static final long serialVersionUID = 1L;

    private final ResourceProfile requested;
    private final long availableCpu;
    private final long availableMem;

    public InsufficientCapacityException(ResourceProfile requested, long availableCpu, long availableMem) {
        super(String.format("Insufficient capacity for %s (available cpu=%d, mem=%d)",
                requested, availableCpu, availableMem));
        this.requested = requested;
        this.availableCpu = availableCpu;
        this.availableMem = availableMem;
    }

    public ResourceProfile requested() {
        return requested;
    }

    public long availableCpu() {
        return availableCpu;
    }

    public long availableMem() {
        return availableMem;
    }
}
