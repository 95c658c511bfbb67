package chaosfuzz.runtime;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChaosConfigTest {

    private static Logger capturingLogger(List<String> messages) {
        Logger logger = Logger.getLogger("chaosfuzz.test.config." + System.nanoTime());
        logger.setUseParentHandlers(false);
        logger.addHandler(new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        });
        return logger;
    }

    @Test
    void defaultsShouldMatchDocumentedValues() {
        ChaosConfig config = ChaosConfig.defaults();

        assertEquals(ChaosConfig.DEFAULT_PROGRAM_ID, config.programId());
        assertEquals(8, config.maxConcurrent());
        assertEquals(2L * 1024 * 1024, config.workerStackSize());
        assertEquals(32, config.chunkSize());
        assertEquals(Duration.ofSeconds(300), config.rateLimitWindow());
        assertEquals(100, config.maxOperationsPerWindow());
        assertEquals(50, config.circuitBreakerThreshold());
        assertEquals(200_000L, config.computeBudget().units());
        assertEquals(1024, config.maxInstructionSize());
        assertFalse(config.configuredRngSeed().isPresent());
        assertTrue(config.evaluateBetweenChunks());
        assertFalse(config.reportPath().isPresent());
    }

    @Test
    void propertiesFileShouldOverrideDefaultsAndWarnOnBadValues() throws Exception {
        Properties properties = new Properties();
        try (InputStream in = ChaosConfigTest.class.getResourceAsStream("/chaos-test.properties")) {
            properties.load(in);
        }
        List<String> messages = new ArrayList<>();

        ChaosConfig config = ChaosConfig.fromProperties(properties, capturingLogger(messages), key -> null);

        assertEquals("TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA", config.programId());
        assertEquals(4, config.maxConcurrent());
        assertEquals(16, config.chunkSize());
        assertEquals(6, config.maxCpu());
        assertEquals(12, config.maxMem());
        assertEquals(Duration.ofSeconds(60), config.rateLimitWindow());
        assertEquals(20, config.maxOperationsPerWindow());
        assertEquals(10, config.circuitBreakerThreshold());
        assertEquals(Duration.ofMillis(250), config.monitorInterval());
        assertEquals(0.25, config.mutationConfig().mutationRate());
        assertEquals(5, config.mutationConfig().intensity());
        assertEquals(100_000L, config.computeBudget().units());
        assertEquals(32_768L, config.computeBudget().heap().getAsLong());
        assertEquals(Duration.ofMillis(1500), config.timeout());
        assertEquals(99L, config.configuredRngSeed().getAsLong());
        assertFalse(config.evaluateBetweenChunks());
        assertEquals(ChaosConfig.DEFAULT_WORKER_STACK_SIZE, config.workerStackSize());
        assertTrue(messages.stream().anyMatch(m -> m.contains("chaos.workerStackSize")));
    }

    @Test
    void environmentShouldFillKeysMissingFromFile() {
        Map<String, String> env = Map.of("CHAOS_MAX_OPERATIONS_PER_WINDOW", "7", "CHAOS_MUTATE_ACCOUNTS", "false");

        ChaosConfig config = ChaosConfig.fromProperties(new Properties(), Logger.getLogger("chaosfuzz.test"), env::get);

        assertEquals(7, config.maxOperationsPerWindow());
        assertFalse(config.mutationConfig().mutateAccounts());
    }

    @Test
    void environmentNameShouldBeUpperSnakeCase() {
        assertEquals("CHAOS_MAX_CONCURRENT", ChaosConfig.environmentName("chaos.maxConcurrent"));
        assertEquals("CHAOS_RNG_SEED", ChaosConfig.environmentName("chaos.rngSeed"));
    }

    @Test
    void loadShouldReadFileFromDisk() throws Exception {
        Path dir = Files.createTempDirectory("chaosfuzz-config-test-");
        Path file = dir.resolve("chaos.properties");
        try {
            Files.writeString(file, "chaos.maxCpu=3\nchaos.reportPath=" + dir.resolve("report.json") + "\n");
            ChaosConfig config = ChaosConfig.load(file, Logger.getLogger("chaosfuzz.test"));

            assertEquals(3, config.maxCpu());
            assertEquals(dir.resolve("report.json"), config.reportPath().orElseThrow());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void invalidValuesShouldBeRejectedAtBuild() {
        assertThrows(IllegalArgumentException.class, () -> ChaosConfig.builder().maxConcurrent(0).build());
        assertThrows(IllegalArgumentException.class, () -> ChaosConfig.builder().mutationRate(2.0).build());
        assertThrows(IllegalArgumentException.class, () -> ChaosConfig.builder().timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> ChaosConfig.builder().maxCpu(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ChaosConfig.builder().programId(" ").build());
    }
}
