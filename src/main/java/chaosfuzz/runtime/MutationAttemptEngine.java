package chaosfuzz.runtime;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.AccountRef;
import chaosfuzz.model.TestCase;
import chaosfuzz.mutators.AccountFlagMutator;
import chaosfuzz.mutators.BitFlipMutator;
import chaosfuzz.mutators.ByteNullMutator;
import chaosfuzz.mutators.ByteRandomMutator;
import chaosfuzz.mutators.ByteRepeatMutator;
import chaosfuzz.mutators.MutationConfig;
import chaosfuzz.mutators.MutationContext;
import chaosfuzz.mutators.MutationResult;
import chaosfuzz.mutators.MutationStatus;
import chaosfuzz.mutators.Mutator;
import chaosfuzz.mutators.MutatorType;
import chaosfuzz.runtime.monitoring.GlobalStats;
import chaosfuzz.runtime.scheduling.MutatorScheduler;
import chaosfuzz.runtime.scheduling.MutatorScheduler.MutationAttemptStatus;
import chaosfuzz.runtime.scheduling.UniformRandomMutatorScheduler;

/**
 * Produces mutated test cases. The parent is never modified; every call works
 * on a private copy of its payload and account list.
 *
 * <p>All randomness comes from the {@link Random} passed to
 * {@link #mutate(TestCase, MutationConfig, Random)}, so a fixed seed yields a
 * fixed output.
 */
public final class MutationAttemptEngine {

    private static final Logger LOGGER = LoggingConfig.getLogger(MutationAttemptEngine.class);
    private static final Map<MutatorType, Supplier<Mutator>> MUTATOR_FACTORIES = buildFactoryMap();

    private final MutatorScheduler scheduler;
    private final GlobalStats globalStats;
    private final AccountFlagMutator accountFlagMutator = new AccountFlagMutator();

    public MutationAttemptEngine() {
        this(new UniformRandomMutatorScheduler(), new GlobalStats());
    }

    public MutationAttemptEngine(MutatorScheduler scheduler, GlobalStats globalStats) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.globalStats = Objects.requireNonNull(globalStats, "globalStats");
    }

    public TestCase mutate(TestCase parent, MutationConfig config, Random random) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(random, "random");

        byte[] payload = parent.getPayload();
        boolean mutatePayload = random.nextDouble() < config.mutationRate();
        int applied = 0;
        if (mutatePayload) {
            for (int round = 0; round < config.intensity(); round++) {
                if (applyRound(parent, payload, random)) {
                    applied++;
                }
            }
        }

        List<AccountRef> accounts = parent.getAccounts();
        if (config.mutateAccounts()) {
            accounts = accountFlagMutator.mutate(accounts, random);
        }

        if (applied == 0 && accounts.equals(parent.getAccounts()) && parent.hasSamePayload(payload)) {
            return parent.copy();
        }
        LOGGER.log(Level.FINE, () -> String.format("Mutated %s with %d payload round(s)",
                parent.getName(), config.intensity()));
        return parent.mutated(payload, accounts);
    }

    private boolean applyRound(TestCase parent, byte[] payload, Random random) {
        MutatorType mutatorType = scheduler.pickMutator(parent, random);
        if (payload.length == 0) {
            recordAttempt(mutatorType, MutationAttemptStatus.NOT_APPLICABLE);
            return false;
        }
        int index = random.nextInt(payload.length);
        Mutator mutator = MUTATOR_FACTORIES.get(mutatorType).get();
        MutationContext ctx = new MutationContext(random, parent, payload, index);
        if (!mutator.isApplicable(ctx)) {
            recordAttempt(mutatorType, MutationAttemptStatus.NOT_APPLICABLE);
            return false;
        }
        MutationResult result = mutator.mutate(ctx);
        if (result == null || result.status() != MutationStatus.SUCCESS) {
            LOGGER.log(Level.FINE, String.format("Mutator %s did not succeed on %s: %s",
                    mutatorType, parent.getName(), result != null ? result.detail() : "null result"));
            recordAttempt(mutatorType, MutationAttemptStatus.FAILED);
            return false;
        }
        recordAttempt(mutatorType, MutationAttemptStatus.SUCCESS);
        return true;
    }

    private void recordAttempt(MutatorType mutatorType, MutationAttemptStatus status) {
        scheduler.recordMutationAttempt(mutatorType, status);
        globalStats.recordMutationAttempt(mutatorType, status);
    }

    private static Map<MutatorType, Supplier<Mutator>> buildFactoryMap() {
        Map<MutatorType, Supplier<Mutator>> map = new EnumMap<>(MutatorType.class);
        map.put(MutatorType.BIT_FLIP, BitFlipMutator::new);
        map.put(MutatorType.BYTE_REPEAT, ByteRepeatMutator::new);
        map.put(MutatorType.BYTE_NULL, ByteNullMutator::new);
        map.put(MutatorType.BYTE_RANDOM, ByteRandomMutator::new);
        return map;
    }
}
