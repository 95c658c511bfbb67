package chaosfuzz.mutators;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import chaosfuzz.model.AccountRef;

/**
 * Toggles the signer and writable flags of one random account, each with an
 * independent 50% chance.
 */
public class AccountFlagMutator {

    public List<AccountRef> mutate(List<AccountRef> accounts, Random rng) {
        if (accounts.isEmpty()) {
            return accounts;
        }
        List<AccountRef> copy = new ArrayList<>(accounts);
        int idx = rng.nextInt(copy.size());
        AccountRef account = copy.get(idx);
        if (rng.nextBoolean()) {
            account = account.withSigner(!account.isSigner());
        }
        if (rng.nextBoolean()) {
            account = account.withWritable(!account.isWritable());
        }
        copy.set(idx, account);
        return List.copyOf(copy);
    }
}
