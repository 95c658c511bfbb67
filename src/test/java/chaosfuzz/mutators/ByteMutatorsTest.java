package chaosfuzz.mutators;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import chaosfuzz.model.AccountRef;
import chaosfuzz.model.TestCase;
import chaosfuzz.support.TestCases;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ByteMutatorsTest {

    /** Returns the scripted ints in order; booleans come from the same script (0 is false). */
    private static final class FixedRandom extends Random {
        private static final long serialVersionUID = 1L;
        private final int[] values;
        private int next;

        FixedRandom(int... values) {
            this.values = values;
        }

        @Override
        public int nextInt(int bound) {
            return values[next++];
        }

        @Override
        public boolean nextBoolean() {
            return values[next++] != 0;
        }
    }

    private static MutationContext ctx(Random random, byte[] payload, int index) {
        TestCase parent = TestCases.withPayload("ctx", payload);
        return new MutationContext(random, parent, payload, index);
    }

    @Test
    void bitFlipShouldFlipExactlyTheChosenBit() {
        byte[] payload = {0b0000_0000, 0b0000_1111};
        MutationResult result = new BitFlipMutator().mutate(ctx(new FixedRandom(7), payload, 1));

        assertEquals(MutationStatus.SUCCESS, result.status());
        assertArrayEquals(new byte[] {0, (byte) 0b1000_1111}, payload);
    }

    @Test
    void byteRepeatShouldCopyPreviousByte() {
        byte[] payload = {5, 6, 7};
        new ByteRepeatMutator().mutate(ctx(new FixedRandom(), payload, 2));
        assertArrayEquals(new byte[] {5, 6, 6}, payload);
    }

    @Test
    void byteRepeatShouldBeNoOpAtIndexZero() {
        byte[] payload = {5, 6, 7};
        ByteRepeatMutator mutator = new ByteRepeatMutator();
        MutationContext context = ctx(new FixedRandom(), payload, 0);

        assertFalse(mutator.isApplicable(context));
        assertEquals(MutationStatus.SKIPPED, mutator.mutate(context).status());
        assertArrayEquals(new byte[] {5, 6, 7}, payload);
    }

    @Test
    void byteNullShouldZeroTheTarget() {
        byte[] payload = {9, 9, 9};
        new ByteNullMutator().mutate(ctx(new FixedRandom(), payload, 1));
        assertArrayEquals(new byte[] {9, 0, 9}, payload);
    }

    @Test
    void byteRandomShouldWriteTheDrawnValue() {
        byte[] payload = {1, 2};
        new ByteRandomMutator().mutate(ctx(new FixedRandom(200), payload, 0));
        assertArrayEquals(new byte[] {(byte) 200, 2}, payload);
    }

    @Test
    void mutatorsShouldSkipEmptyPayload() {
        byte[] empty = new byte[0];
        MutationContext context = ctx(new FixedRandom(), empty, -1);
        for (Mutator mutator : List.of(new BitFlipMutator(), new ByteRepeatMutator(),
                new ByteNullMutator(), new ByteRandomMutator())) {
            assertFalse(mutator.isApplicable(context));
            assertEquals(MutationStatus.SKIPPED, mutator.mutate(context).status());
        }
    }

    @Test
    void accountFlagMutatorShouldToggleChosenFlags() {
        List<AccountRef> accounts = TestCases.accounts();
        // Account 1; flip signer, keep writable.
        List<AccountRef> mutated = new AccountFlagMutator().mutate(accounts, new FixedRandom(1, 1, 0));

        assertEquals(accounts.get(0), mutated.get(0));
        assertTrue(mutated.get(1).isSigner());
        assertTrue(mutated.get(1).isWritable());
        assertFalse(accounts.get(1).isSigner());
    }

    @Test
    void accountFlagMutatorShouldLeaveEmptyListAlone() {
        List<AccountRef> empty = List.of();
        assertSame(empty, new AccountFlagMutator().mutate(empty, new FixedRandom()));
    }

    @Test
    void mutationConfigShouldRejectOutOfRangeRate() {
        assertThrows(IllegalArgumentException.class, () -> new MutationConfig(1.5, 1));
        assertThrows(IllegalArgumentException.class, () -> new MutationConfig(-0.1, 1));
        assertThrows(IllegalArgumentException.class, () -> new MutationConfig(0.5, -1));
    }
}
