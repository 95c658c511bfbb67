package chaosfuzz.security;

import java.util.ArrayList;
import java.util.List;

import chaosfuzz.model.AccountRef;
import chaosfuzz.model.TestCase;

/**
 * Screens a test case before invocation: instruction size, blocked byte
 * patterns, and account address shape.
 */
public final class InputSanitizer {

    public static final int DEFAULT_MAX_INSTRUCTION_SIZE = 1024;
    public static final byte[] DEFAULT_BLOCKED_PATTERN = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};

    private static final int MIN_ADDRESS_LENGTH = 32;
    private static final int MAX_ADDRESS_LENGTH = 44;
    private static final String BASE58_ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    private final int maxInstructionSize;
    private final List<byte[]> blockedPatterns;

    public InputSanitizer() {
        this(DEFAULT_MAX_INSTRUCTION_SIZE, List.of(DEFAULT_BLOCKED_PATTERN));
    }

    public InputSanitizer(int maxInstructionSize, List<byte[]> blockedPatterns) {
        if (maxInstructionSize <= 0) {
            throw new IllegalArgumentException("Max instruction size must be positive.");
        }
        this.maxInstructionSize = maxInstructionSize;
        List<byte[]> copy = new ArrayList<>(blockedPatterns.size());
        for (byte[] pattern : blockedPatterns) {
            if (pattern.length == 0) {
                throw new IllegalArgumentException("Blocked pattern must not be empty.");
            }
            copy.add(pattern.clone());
        }
        this.blockedPatterns = List.copyOf(copy);
    }

    public int maxInstructionSize() {
        return maxInstructionSize;
    }

    public void validate(TestCase testCase) throws InputValidationException {
        validateInstruction(testCase.getPayload());
        for (AccountRef account : testCase.getAccounts()) {
            validateAccount(account);
        }
    }

    public void validateInstruction(byte[] data) throws SecurityViolationException {
        if (data.length > maxInstructionSize) {
            throw new SecurityViolationException(String.format(
                    "Instruction size %d exceeds maximum %d", data.length, maxInstructionSize));
        }
        for (byte[] pattern : blockedPatterns) {
            if (indexOf(data, pattern) >= 0) {
                throw new SecurityViolationException("Blocked instruction pattern detected");
            }
        }
    }

    public void validateAccount(AccountRef account) throws AccountValidationException {
        String address = account.address();
        if (address.length() < MIN_ADDRESS_LENGTH || address.length() > MAX_ADDRESS_LENGTH) {
            throw new AccountValidationException(String.format(
                    "Account address %s has invalid length %d", address, address.length()));
        }
        for (int i = 0; i < address.length(); i++) {
            if (BASE58_ALPHABET.indexOf(address.charAt(i)) < 0) {
                throw new AccountValidationException(String.format(
                        "Account address %s contains non-base58 character '%c'", address, address.charAt(i)));
            }
        }
    }

    static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i + pattern.length <= data.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
