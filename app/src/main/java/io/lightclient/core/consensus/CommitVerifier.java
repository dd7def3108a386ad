package io.lightclient.core.consensus;

import io.lightclient.core.protocol.Commit;
import io.lightclient.core.protocol.CommitSig;
import io.lightclient.core.protocol.ProtocolLimits;
import io.lightclient.core.protocol.SignatureVerifier;
import io.lightclient.core.protocol.Validator;
import io.lightclient.core.protocol.ValidatorSet;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Tallies the voting power behind a commit.
 *
 * A signature that fails verification only drops its own slot; a slot whose encoding is
 * malformed, that names the wrong validator, or that votes twice rejects the whole commit.
 * Only {@code COMMIT} slots count; nil votes are skipped.
 */
public final class CommitVerifier {
    private static final Logger LOG = Logger.getLogger(CommitVerifier.class.getName());

    /** Base BFT safety threshold. */
    public static final TrustLevel QUORUM = TrustLevel.TWO_THIRDS;

    private final SignatureVerifier signatures;

    public CommitVerifier(SignatureVerifier signatures) {
        if (signatures == null) throw new IllegalArgumentException("signature verifier required");
        this.signatures = signatures;
    }

    public record QuorumResult(boolean hasQuorum, long votingPowerSigned, long totalVotingPower) {}

    /**
     * Positional check of {@code commit} against the set that produced it: slot i must be
     * validator i. Quorum is at least 2/3 of total power by valid signatures.
     */
    public QuorumResult hasQuorum(String chainId, Commit commit, ValidatorSet validators) {
        if (commit.size() != validators.size()) {
            throw new LightClientException(ErrorCode.INVALID_COMMIT, commit.height(),
                    "commit has " + commit.size() + " slots but validator set has " + validators.size());
        }
        Set<String> validSigners = new HashSet<>();
        for (int i = 0; i < commit.size(); i++) {
            CommitSig sig = commit.signatures().get(i);
            if (sig.isAbsent()) {
                continue;
            }
            Validator expected = validators.get(i);
            if (!expected.address().equals(sig.validatorAddress())) {
                throw new LightClientException(ErrorCode.INVALID_COMMIT, commit.height(),
                        "slot " + i + " signed by " + sig.validatorAddress() + ", expected " + expected.address());
            }
            if (countsFor(chainId, commit, i, expected)) {
                validSigners.add(expected.address());
            }
        }
        long signed = validators.votingPowerIn(validSigners);
        long total = validators.totalVotingPower();
        return new QuorumResult(QUORUM.isMetBy(signed, total), signed, total);
    }

    public void verifyQuorum(String chainId, Commit commit, ValidatorSet validators) {
        QuorumResult result = hasQuorum(chainId, commit, validators);
        if (!result.hasQuorum()) {
            throw new LightClientException(ErrorCode.INSUFFICIENT_VOTING_POWER, commit.height(),
                    "valid signatures hold " + result.votingPowerSigned() + " of " + result.totalVotingPower()
                            + " voting power, need " + QUORUM);
        }
    }

    /**
     * Power of {@code trusted} members with a valid signature in {@code commit}, looked up by
     * address. Signers unknown to {@code trusted} are ignored: the committee may have rotated.
     */
    public long trustedPowerSigned(String chainId, Commit commit, ValidatorSet trusted) {
        Set<String> seen = new HashSet<>();
        Set<String> validSigners = new HashSet<>();
        for (int i = 0; i < commit.size(); i++) {
            CommitSig sig = commit.signatures().get(i);
            if (sig.isAbsent()) {
                continue;
            }
            if (!seen.add(sig.validatorAddress())) {
                throw new LightClientException(ErrorCode.INVALID_COMMIT, commit.height(),
                        "validator " + sig.validatorAddress() + " voted twice");
            }
            Optional<Validator> member = trusted.getByAddress(sig.validatorAddress());
            if (member.isEmpty()) {
                continue;
            }
            if (countsFor(chainId, commit, i, member.get())) {
                validSigners.add(sig.validatorAddress());
            }
        }
        return trusted.votingPowerIn(validSigners);
    }

    public void verifyTrustLevel(String chainId, Commit commit, ValidatorSet trusted, TrustLevel trustLevel) {
        long signed = trustedPowerSigned(chainId, commit, trusted);
        long total = trusted.totalVotingPower();
        if (!trustLevel.isMetBy(signed, total)) {
            throw new LightClientException(ErrorCode.INSUFFICIENT_VOTING_POWER, commit.height(),
                    "trusted validators holding " + signed + " of " + total
                            + " voting power signed, need " + trustLevel);
        }
    }

    private boolean countsFor(String chainId, Commit commit, int index, Validator validator) {
        CommitSig sig = commit.signatures().get(index);
        if (!sig.isForBlock()) {
            return false;
        }
        byte[] signature = sig.signature();
        if (signature.length == 0 || signature.length > ProtocolLimits.MAX_SIGNATURE_BYTES) {
            throw new LightClientException(ErrorCode.INVALID_SIGNATURE, commit.height(),
                    "slot " + index + " carries a " + signature.length + "-byte signature");
        }
        boolean ok = signatures.verify(validator.publicKey(), commit.voteSignBytes(chainId, index), signature);
        if (!ok) {
            LOG.fine(() -> "Dropping invalid signature of " + validator.address() + " at height " + commit.height());
        }
        return ok;
    }
}
