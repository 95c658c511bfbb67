package chaosfuzz.model;

/**
 * Declared cpu and memory cost of one test case, in pool units.
 *
 * <p>Both amounts are unsigned 32-bit quantities; they are held in {@code long}
 * fields so callers never see a negative value.
 */
public record ResourceProfile(long cpu, long mem) {

    public static final long MAX_UNITS = 0xFFFF_FFFFL;

    public ResourceProfile {
        if (cpu < 0 || cpu > MAX_UNITS) {
            throw new IllegalArgumentException("cpu out of range: " + cpu);
        }
        if (mem < 0 || mem > MAX_UNITS) {
            throw new IllegalArgumentException("mem out of range: " + mem);
        }
    }

    public static ResourceProfile of(long cpu, long mem) {
        return new ResourceProfile(cpu, mem);
    }

    @Override
    public String toString() {
        return String.format("{cpu:%d, mem:%d}", cpu, mem);
    }
}
