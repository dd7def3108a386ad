package io.lightclient.core.protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.Math.addExact;

/**
 * Immutable validator set, ordered by address. Commits produced by this set align
 * positionally with {@link #validators()}. A changed committee is a new instance.
 */
public final class ValidatorSet {
    private final List<Validator> validators;
    private final Map<String, Integer> indexByAddress;
    private final long totalVotingPower;

    public ValidatorSet(Collection<Validator> validators) {
        if (validators == null || validators.isEmpty()) {
            throw new IllegalArgumentException("validator set must not be empty");
        }
        if (validators.size() > ProtocolLimits.MAX_VALIDATORS) {
            throw new IllegalArgumentException("too many validators: " + validators.size());
        }
        List<Validator> sorted = new ArrayList<>(validators);
        sorted.sort(Comparator.comparing(Validator::address));

        Map<String, Integer> index = new HashMap<>();
        long total = 0L;
        for (int i = 0; i < sorted.size(); i++) {
            Validator v = sorted.get(i);
            if (index.put(v.address(), i) != null) {
                throw new IllegalArgumentException("duplicate validator address: " + v.address());
            }
            try {
                total = addExact(total, v.votingPower());
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("total voting power overflows", e);
            }
        }
        if (total > ProtocolLimits.MAX_TOTAL_VOTING_POWER) {
            throw new IllegalArgumentException("total voting power exceeds maximum: " + total);
        }
        this.validators = List.copyOf(sorted);
        this.indexByAddress = Map.copyOf(index);
        this.totalVotingPower = total;
    }

    public static ValidatorSet of(Validator... validators) {
        return new ValidatorSet(List.of(validators));
    }

    public List<Validator> validators() { return validators; }
    public int size() { return validators.size(); }
    public Validator get(int index) { return validators.get(index); }
    public long totalVotingPower() { return totalVotingPower; }

    public Optional<Validator> getByAddress(String address) {
        Integer idx = address == null ? null : indexByAddress.get(address);
        return idx == null ? Optional.empty() : Optional.of(validators.get(idx));
    }

    /**
     * Sums the power of members present in {@code signers}. Unknown addresses are
     * ignored: a commit may name validators a stale set no longer holds.
     */
    public long votingPowerIn(Set<String> signers) {
        if (signers == null) return 0L;
        long sum = 0L;
        for (String address : signers) {
            Integer idx = indexByAddress.get(address);
            if (idx != null) {
                sum = addExact(sum, validators.get(idx).votingPower());
            }
        }
        return sum;
    }

    /** Merkle root over each member's (public key, power) encoding, in address order. */
    public byte[] hash(Hasher hasher) {
        List<byte[]> leaves = new ArrayList<>(validators.size());
        for (Validator v : validators) leaves.add(v.hashBytes());
        return Merkle.rootOf(leaves, hasher);
    }

    @Override public boolean equals(Object o) {
        return o instanceof ValidatorSet && validators.equals(((ValidatorSet) o).validators);
    }

    @Override public int hashCode() { return validators.hashCode(); }

    @Override public String toString() {
        return "ValidatorSet{size=" + validators.size() + ", power=" + totalVotingPower + "}";
    }
}
