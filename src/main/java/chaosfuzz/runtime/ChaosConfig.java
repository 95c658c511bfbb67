package chaosfuzz.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

import chaosfuzz.model.ComputeBudget;
import chaosfuzz.mutators.MutationConfig;
import chaosfuzz.security.InputSanitizer;

/**
 * Immutable configuration for one chaos session. Values come from a builder or
 * from a properties file, where every key falls back to a system property of
 * the same name and then to an environment variable
 * ({@code chaos.maxConcurrent} becomes {@code CHAOS_MAX_CONCURRENT}).
 */
public final class ChaosConfig {

    public static final String DEFAULT_PROGRAM_ID = "11111111111111111111111111111111";
    public static final int DEFAULT_MAX_CONCURRENT = 8;
    public static final long DEFAULT_WORKER_STACK_SIZE = 2L * 1024 * 1024;

    private final String programId;
    private final int maxConcurrent;
    private final long workerStackSize;
    private final long maxCpu;
    private final long maxMem;
    private final Duration rateLimitWindow;
    private final int maxOperationsPerWindow;
    private final long circuitBreakerThreshold;
    private final Duration monitorInterval;
    private final MutationConfig mutationConfig;
    private final ComputeBudget computeBudget;
    private final Duration timeout;
    private final PerformanceThresholds performanceThresholds;
    private final int maxInstructionSize;
    private final Long configuredRngSeed;
    private final boolean evaluateBetweenChunks;
    private final Path eventLogPath;
    private final Path reportPath;

    private ChaosConfig(Builder builder) {
        this.programId = builder.programId;
        this.maxConcurrent = builder.maxConcurrent;
        this.workerStackSize = builder.workerStackSize;
        this.maxCpu = builder.maxCpu;
        this.maxMem = builder.maxMem;
        this.rateLimitWindow = builder.rateLimitWindow;
        this.maxOperationsPerWindow = builder.maxOperationsPerWindow;
        this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
        this.monitorInterval = builder.monitorInterval;
        this.mutationConfig = new MutationConfig(builder.mutationRate, builder.mutationIntensity,
                builder.mutateAccounts);
        this.computeBudget = new ComputeBudget(builder.computeUnitLimit, builder.heapBytes);
        this.timeout = builder.timeout;
        this.performanceThresholds = new PerformanceThresholds(builder.performanceThresholdUnits,
                builder.performanceThresholdTime);
        this.maxInstructionSize = builder.maxInstructionSize;
        this.configuredRngSeed = builder.rngSeed;
        this.evaluateBetweenChunks = builder.evaluateBetweenChunks;
        this.eventLogPath = builder.eventLogPath;
        this.reportPath = builder.reportPath;
    }

    public String programId() {
        return programId;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public long workerStackSize() {
        return workerStackSize;
    }

    public long maxCpu() {
        return maxCpu;
    }

    public long maxMem() {
        return maxMem;
    }

    public Duration rateLimitWindow() {
        return rateLimitWindow;
    }

    public int maxOperationsPerWindow() {
        return maxOperationsPerWindow;
    }

    public long circuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public Duration monitorInterval() {
        return monitorInterval;
    }

    public MutationConfig mutationConfig() {
        return mutationConfig;
    }

    public ComputeBudget computeBudget() {
        return computeBudget;
    }

    public Duration timeout() {
        return timeout;
    }

    public PerformanceThresholds performanceThresholds() {
        return performanceThresholds;
    }

    public int maxInstructionSize() {
        return maxInstructionSize;
    }

    public OptionalLong configuredRngSeed() {
        return configuredRngSeed == null
                ? OptionalLong.empty()
                : OptionalLong.of(configuredRngSeed);
    }

    public boolean evaluateBetweenChunks() {
        return evaluateBetweenChunks;
    }

    public Optional<Path> eventLogPath() {
        return Optional.ofNullable(eventLogPath);
    }

    public Optional<Path> reportPath() {
        return Optional.ofNullable(reportPath);
    }

    /** Next power of two at least {@code maxConcurrent * 4}. */
    public int chunkSize() {
        return chunkSizeFor(maxConcurrent);
    }

    static int chunkSizeFor(int maxConcurrent) {
        int wanted = Math.max(1, maxConcurrent * 4);
        int highest = Integer.highestOneBit(wanted);
        return highest == wanted ? wanted : highest << 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ChaosConfig defaults() {
        return builder().build();
    }

    public static ChaosConfig load(Path file, Logger logger) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        }
        logger.info(String.format("Loaded chaos configuration from %s", file));
        return fromProperties(properties, logger);
    }

    public static ChaosConfig fromProperties(Properties properties, Logger logger) {
        return fromProperties(properties, logger, System::getenv);
    }

    static ChaosConfig fromProperties(Properties properties, Logger logger, Function<String, String> environment) {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(logger, "logger");
        PropertyResolver resolver = new PropertyResolver(properties, logger, environment);
        Builder b = builder();
        resolver.string("chaos.programId", b::programId);
        resolver.integer("chaos.maxConcurrent", b::maxConcurrent);
        resolver.longValue("chaos.workerStackSize", b::workerStackSize);
        resolver.longValue("chaos.maxCpu", b::maxCpu);
        resolver.longValue("chaos.maxMem", b::maxMem);
        resolver.longValue("chaos.rateLimitWindowSeconds", v -> b.rateLimitWindow(Duration.ofSeconds(v)));
        resolver.integer("chaos.maxOperationsPerWindow", b::maxOperationsPerWindow);
        resolver.longValue("chaos.circuitBreakerThreshold", b::circuitBreakerThreshold);
        resolver.longValue("chaos.monitorIntervalMillis", v -> b.monitorInterval(Duration.ofMillis(v)));
        resolver.decimal("chaos.mutationRate", b::mutationRate);
        resolver.integer("chaos.mutationIntensity", b::mutationIntensity);
        resolver.bool("chaos.mutateAccounts", b::mutateAccounts);
        resolver.longValue("chaos.computeUnitLimit", b::computeUnitLimit);
        resolver.longValue("chaos.heapBytes", b::heapBytes);
        resolver.longValue("chaos.timeoutMillis", v -> b.timeout(Duration.ofMillis(v)));
        resolver.longValue("chaos.performanceThresholdUnits", b::performanceThresholdUnits);
        resolver.longValue("chaos.performanceThresholdMillis",
                v -> b.performanceThresholdTime(Duration.ofMillis(v)));
        resolver.integer("chaos.maxInstructionSize", b::maxInstructionSize);
        resolver.longValue("chaos.rngSeed", b::rngSeed);
        resolver.bool("chaos.evaluateBetweenChunks", b::evaluateBetweenChunks);
        resolver.string("chaos.eventLog", v -> b.eventLogPath(Path.of(v)));
        resolver.string("chaos.reportPath", v -> b.reportPath(Path.of(v)));
        return b.build();
    }

    /** {@code chaos.maxConcurrent} to {@code CHAOS_MAX_CONCURRENT}. */
    static String environmentName(String key) {
        StringBuilder sb = new StringBuilder();
        for (char c : key.toCharArray()) {
            if (c == '.') {
                sb.append('_');
            } else if (Character.isUpperCase(c)) {
                sb.append('_').append(c);
            } else {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }

    private static final class PropertyResolver {
        private final Properties properties;
        private final Logger logger;
        private final Function<String, String> environment;

        PropertyResolver(Properties properties, Logger logger, Function<String, String> environment) {
            this.properties = properties;
            this.logger = logger;
            this.environment = environment;
        }

        private String raw(String key) {
            String value = properties.getProperty(key);
            if (value == null || value.isBlank()) {
                value = System.getProperty(key);
            }
            if (value == null || value.isBlank()) {
                value = environment.apply(environmentName(key));
            }
            return (value == null || value.isBlank()) ? null : value.trim();
        }

        void string(String key, Consumer<String> sink) {
            String value = raw(key);
            if (value != null) {
                sink.accept(value);
            }
        }

        void integer(String key, Consumer<Integer> sink) {
            String value = raw(key);
            if (value == null) {
                return;
            }
            try {
                sink.accept(Integer.parseInt(value));
            } catch (NumberFormatException nfe) {
                logger.warning(String.format("Invalid integer '%s' for %s; keeping default.", value, key));
            }
        }

        void longValue(String key, Consumer<Long> sink) {
            String value = raw(key);
            if (value == null) {
                return;
            }
            try {
                sink.accept(Long.parseLong(value));
            } catch (NumberFormatException nfe) {
                logger.warning(String.format("Invalid number '%s' for %s; keeping default.", value, key));
            }
        }

        void decimal(String key, Consumer<Double> sink) {
            String value = raw(key);
            if (value == null) {
                return;
            }
            try {
                sink.accept(Double.parseDouble(value));
            } catch (NumberFormatException nfe) {
                logger.warning(String.format("Invalid decimal '%s' for %s; keeping default.", value, key));
            }
        }

        void bool(String key, Consumer<Boolean> sink) {
            String value = raw(key);
            if (value == null) {
                return;
            }
            String normalized = value.toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                sink.accept(Boolean.parseBoolean(normalized));
            } else {
                logger.warning(String.format("Invalid boolean '%s' for %s; keeping default.", value, key));
            }
        }
    }

    public static final class Builder {
        private String programId = DEFAULT_PROGRAM_ID;
        private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
        private long workerStackSize = DEFAULT_WORKER_STACK_SIZE;
        private long maxCpu = 8;
        private long maxMem = 16;
        private Duration rateLimitWindow = Duration.ofSeconds(300);
        private int maxOperationsPerWindow = 100;
        private long circuitBreakerThreshold = 50;
        private Duration monitorInterval = Duration.ofSeconds(5);
        private double mutationRate = 0.5;
        private int mutationIntensity = 3;
        private boolean mutateAccounts = true;
        private long computeUnitLimit = 200_000L;
        private Long heapBytes;
        private Duration timeout = Duration.ofSeconds(30);
        private long performanceThresholdUnits = PerformanceThresholds.DEFAULT.computeUnits();
        private Duration performanceThresholdTime = PerformanceThresholds.DEFAULT.executionTime();
        private int maxInstructionSize = InputSanitizer.DEFAULT_MAX_INSTRUCTION_SIZE;
        private Long rngSeed;
        private boolean evaluateBetweenChunks = true;
        private Path eventLogPath;
        private Path reportPath;

        private Builder() {
        }

        public Builder programId(String programId) {
            this.programId = programId;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder workerStackSize(long workerStackSize) {
            this.workerStackSize = workerStackSize;
            return this;
        }

        public Builder maxCpu(long maxCpu) {
            this.maxCpu = maxCpu;
            return this;
        }

        public Builder maxMem(long maxMem) {
            this.maxMem = maxMem;
            return this;
        }

        public Builder rateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = rateLimitWindow;
            return this;
        }

        public Builder maxOperationsPerWindow(int maxOperationsPerWindow) {
            this.maxOperationsPerWindow = maxOperationsPerWindow;
            return this;
        }

        public Builder circuitBreakerThreshold(long circuitBreakerThreshold) {
            this.circuitBreakerThreshold = circuitBreakerThreshold;
            return this;
        }

        public Builder monitorInterval(Duration monitorInterval) {
            this.monitorInterval = monitorInterval;
            return this;
        }

        public Builder mutationRate(double mutationRate) {
            this.mutationRate = mutationRate;
            return this;
        }

        public Builder mutationIntensity(int mutationIntensity) {
            this.mutationIntensity = mutationIntensity;
            return this;
        }

        public Builder mutateAccounts(boolean mutateAccounts) {
            this.mutateAccounts = mutateAccounts;
            return this;
        }

        public Builder computeUnitLimit(long computeUnitLimit) {
            this.computeUnitLimit = computeUnitLimit;
            return this;
        }

        public Builder heapBytes(Long heapBytes) {
            this.heapBytes = heapBytes;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder performanceThresholdUnits(long units) {
            this.performanceThresholdUnits = units;
            return this;
        }

        public Builder performanceThresholdTime(Duration time) {
            this.performanceThresholdTime = time;
            return this;
        }

        public Builder maxInstructionSize(int maxInstructionSize) {
            this.maxInstructionSize = maxInstructionSize;
            return this;
        }

        public Builder rngSeed(Long rngSeed) {
            this.rngSeed = rngSeed;
            return this;
        }

        public Builder evaluateBetweenChunks(boolean evaluateBetweenChunks) {
            this.evaluateBetweenChunks = evaluateBetweenChunks;
            return this;
        }

        public Builder eventLogPath(Path eventLogPath) {
            this.eventLogPath = eventLogPath;
            return this;
        }

        public Builder reportPath(Path reportPath) {
            this.reportPath = reportPath;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public ChaosConfig build() {
            if (programId == null || programId.isBlank()) {
                throw new IllegalArgumentException("Program id is required.");
            }
            if (maxConcurrent <= 0) {
                throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
            }
            if (workerStackSize < 0) {
                throw new IllegalArgumentException("Worker stack size must not be negative.");
            }
            requireUnits("maxCpu", maxCpu);
            requireUnits("maxMem", maxMem);
            requirePositive("rateLimitWindow", rateLimitWindow);
            if (maxOperationsPerWindow <= 0) {
                throw new IllegalArgumentException("maxOperationsPerWindow must be positive.");
            }
            if (circuitBreakerThreshold < 0) {
                throw new IllegalArgumentException("Circuit breaker threshold must not be negative.");
            }
            requirePositive("monitorInterval", monitorInterval);
            requirePositive("timeout", timeout);
            if (maxInstructionSize <= 0) {
                throw new IllegalArgumentException("maxInstructionSize must be positive.");
            }
            // Remaining checks live in the value types built below.
            return new ChaosConfig(this);
        }

        private static void requireUnits(String name, long value) {
            if (value < 0 || value > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException(name + " out of range: " + value);
            }
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be a positive duration.");
            }
        }
    }
}
