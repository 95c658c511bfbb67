package chaosfuzz.runtime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import chaosfuzz.model.ResourceProfile;

/**
 * Lock-free two-resource admission control.
 *
 * <p>Available cpu and memory are packed into one {@link AtomicLong} (cpu in
 * the high 32 bits, memory in the low 32 bits), so a single compare-and-set
 * checks and takes both amounts at once. {@link #acquire} never blocks: it
 * either succeeds, fails fast, or retries only because another thread won the
 * race for the same word.
 */
public final class ResourcePool {

    private static final long LOW_MASK = 0xFFFF_FFFFL;

    private final long maxCpu;
    private final long maxMem;
    private final AtomicLong available;

    public ResourcePool(long maxCpu, long maxMem) {
        if (maxCpu < 0 || maxCpu > ResourceProfile.MAX_UNITS) {
            throw new IllegalArgumentException("maxCpu out of range: " + maxCpu);
        }
        if (maxMem < 0 || maxMem > ResourceProfile.MAX_UNITS) {
            throw new IllegalArgumentException("maxMem out of range: " + maxMem);
        }
        this.maxCpu = maxCpu;
        this.maxMem = maxMem;
        this.available = new AtomicLong(pack(maxCpu, maxMem));
    }

    /**
     * Takes {@code profile} from the pool, or throws without taking anything if
     * either dimension is short.
     */
    public void acquire(ResourceProfile profile) throws InsufficientCapacityException {
        Objects.requireNonNull(profile, "profile");
        while (true) {
            long current = available.get();
            long cpu = cpuOf(current);
            long mem = memOf(current);
            if (cpu < profile.cpu() || mem < profile.mem()) {
                throw new InsufficientCapacityException(profile, cpu, mem);
            }
            long next = pack(cpu - profile.cpu(), mem - profile.mem());
            if (available.compareAndSet(current, next)) {
                return;
            }
        }
    }

    /**
     * Returns a previously acquired profile. Each dimension is capped at its
     * maximum, so a stray release cannot push the pool above capacity.
     */
    public void release(ResourceProfile profile) {
        Objects.requireNonNull(profile, "profile");
        while (true) {
            long current = available.get();
            long next = pack(Math.min(maxCpu, cpuOf(current) + profile.cpu()),
                    Math.min(maxMem, memOf(current) + profile.mem()));
            if (available.compareAndSet(current, next)) {
                return;
            }
        }
    }

    public long availableCpu() {
        return cpuOf(available.get());
    }

    public long availableMem() {
        return memOf(available.get());
    }

    public long maxCpu() {
        return maxCpu;
    }

    public long maxMem() {
        return maxMem;
    }

    /** Both counters read from the same word, so the pair is consistent. */
    public Snapshot snapshot() {
        long current = available.get();
        return new Snapshot(cpuOf(current), memOf(current), maxCpu, maxMem);
    }

    private static long pack(long cpu, long mem) {
        return (cpu << 32) | (mem & LOW_MASK);
    }

    private static long cpuOf(long packed) {
        return packed >>> 32;
    }

    private static long memOf(long packed) {
        return packed & LOW_MASK;
    }

    public record Snapshot(long availableCpu, long availableMem, long maxCpu, long maxMem) {
        public boolean isFull() {
            return availableCpu == maxCpu && availableMem == maxMem;
        }
    }
}
