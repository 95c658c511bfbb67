package chaosfuzz.model;

import java.util.Objects;

/** An account passed to the target program for one invocation. */
public record AccountRef(String address, boolean isSigner, boolean isWritable) {

    public AccountRef {
        Objects.requireNonNull(address, "address");
    }

    public AccountRef withSigner(boolean signer) {
        return new AccountRef(address, signer, isWritable);
    }

    public AccountRef withWritable(boolean writable) {
        return new AccountRef(address, isSigner, writable);
    }
}
