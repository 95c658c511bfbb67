package chaosfuzz.target;

import java.util.List;
import java.util.Objects;

import chaosfuzz.model.AccountRef;
import chaosfuzz.model.ComputeBudget;

public record Invocation(String programId, List<AccountRef> accounts, byte[] payload, ComputeBudget budget) {

    public Invocation {
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(budget, "budget");
        accounts = List.copyOf(accounts);
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
