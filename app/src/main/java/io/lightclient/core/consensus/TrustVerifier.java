package io.lightclient.core.consensus;

import io.lightclient.core.metrics.VerificationMetrics;
import io.lightclient.core.protocol.Hasher;
import io.lightclient.core.protocol.Hex;
import io.lightclient.core.protocol.LightBlock;
import io.lightclient.core.protocol.SignatureVerifier;
import io.lightclient.core.protocol.SignedHeader;
import io.lightclient.core.protocol.ValidatorSet;
import io.lightclient.core.provider.HeaderProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether an untrusted signed header can be trusted given a trusted one.
 *
 * <ul>
 *   <li>Adjacent (height + 1, or the same validator set): 2/3 quorum of the committee the
 *   trusted header already agreed on, plus the trust level of it.</li>
 *   <li>Skip: trusted validators holding {@code trustLevel} of the trusted power must have
 *   signed, and the untrusted set must have a 2/3 quorum over its own commit.</li>
 *   <li>Bisection: when only the trust level falls short, fetch the binary midpoint from the
 *   header provider and verify trusted to midpoint, then midpoint to untrusted. If no
 *   intermediate header closes the gap the shortfall stands as INSUFFICIENT_VOTING_POWER;
 *   only a misbehaving provider (thrown error, wrong height) ends in NO_TRUST_PATH.</li>
 * </ul>
 *
 * Every hop first checks that the validator set hashes to the header's validators hash
 * and that the commit is for that header. Nothing is retried here.
 */
public final class TrustVerifier {
    private static final Logger LOG = Logger.getLogger(TrustVerifier.class.getName());

    public static final int DEFAULT_MAX_BISECTION_DEPTH = 64;

    private final Hasher hasher;
    private final CommitVerifier commits;
    private final HeaderProvider provider;
    private final int maxBisectionDepth;
    private final VerificationMetrics metrics;

    public TrustVerifier(Hasher hasher, SignatureVerifier signatures) {
        this(hasher, signatures, HeaderProvider.none());
    }

    public TrustVerifier(Hasher hasher, SignatureVerifier signatures, HeaderProvider provider) {
        this(hasher, signatures, provider, DEFAULT_MAX_BISECTION_DEPTH, new VerificationMetrics());
    }

    public TrustVerifier(Hasher hasher,
                         SignatureVerifier signatures,
                         HeaderProvider provider,
                         int maxBisectionDepth,
                         VerificationMetrics metrics) {
        if (hasher == null) throw new IllegalArgumentException("hasher required");
        if (maxBisectionDepth < 1) throw new IllegalArgumentException("max bisection depth must be >= 1");
        this.hasher = hasher;
        this.commits = new CommitVerifier(signatures);
        this.provider = provider != null ? provider : HeaderProvider.none();
        this.maxBisectionDepth = maxBisectionDepth;
        this.metrics = metrics != null ? metrics : new VerificationMetrics();
    }

    public Hasher hasher() {
        return hasher;
    }

    public CommitVerifier commits() {
        return commits;
    }

    /**
     * Returns normally iff {@code untrustedHeader} can be trusted.
     *
     * Callers have already checked the trusted header is within its trusting period and the
     * untrusted one is newer than it.
     *
     * @throws LightClientException naming the failed check and the height it failed at
     */
    public void verify(SignedHeader trustedHeader,
                       ValidatorSet trustedValidators,
                       SignedHeader untrustedHeader,
                       ValidatorSet untrustedValidators,
                       TrustLevel trustLevel,
                       Instant now,
                       Duration maxClockDrift) {
        if (trustLevel == null) throw new IllegalArgumentException("trust level required");
        if (now == null) throw new IllegalArgumentException("now required");
        if (maxClockDrift == null || maxClockDrift.isNegative()) {
            throw new IllegalArgumentException("max clock drift must be >= 0");
        }
        LightBlock trusted = new LightBlock(trustedHeader, trustedValidators);
        LightBlock untrusted = new LightBlock(untrustedHeader, untrustedValidators);
        verify(trusted, untrusted, trustLevel, now.plus(maxClockDrift), 0);
    }

    private void verify(LightBlock trusted, LightBlock untrusted, TrustLevel trustLevel, Instant latestAllowed, int depth) {
        checkOrdering(trusted, untrusted, latestAllowed);
        checkIdentity(trusted, untrusted);

        SignedHeader header = untrusted.signedHeader();
        String chainId = header.chainId();

        if (isAdjacent(trusted, untrusted)) {
            if (!Arrays.equals(header.header().validatorsHash(), trusted.signedHeader().header().nextValidatorsHash())) {
                throw new LightClientException(ErrorCode.VALIDATOR_SET_MISMATCH, untrusted.height(),
                        "validators hash " + Hex.shortHex(header.header().validatorsHash())
                                + " is not the next validators hash agreed at height " + trusted.height());
            }
            verifyDirect(chainId, untrusted, untrusted.validatorSet(), trustLevel);
            return;
        }
        if (untrusted.validatorSet().equals(trusted.validatorSet())) {
            verifyDirect(chainId, untrusted, trusted.validatorSet(), trustLevel);
            return;
        }

        try {
            commits.verifyTrustLevel(chainId, header.commit(), trusted.validatorSet(), trustLevel);
        } catch (LightClientException e) {
            if (e.code() != ErrorCode.INSUFFICIENT_VOTING_POWER) {
                throw e;
            }
            LOG.fine(() -> "Trust level not met " + trusted.height() + " -> " + untrusted.height() + ", bisecting");
            bisect(trusted, untrusted, trustLevel, latestAllowed, depth, e);
            return;
        }
        commits.verifyQuorum(chainId, header.commit(), untrusted.validatorSet());
    }

    /** Full quorum of {@code committee} plus the trust level of it. */
    private void verifyDirect(String chainId, LightBlock untrusted, ValidatorSet committee, TrustLevel trustLevel) {
        CommitVerifier.QuorumResult quorum = commits.hasQuorum(chainId, untrusted.signedHeader().commit(), committee);
        if (!quorum.hasQuorum()) {
            throw new LightClientException(ErrorCode.INSUFFICIENT_VOTING_POWER, untrusted.height(),
                    "valid signatures hold " + quorum.votingPowerSigned() + " of " + quorum.totalVotingPower()
                            + " voting power, need " + CommitVerifier.QUORUM);
        }
        if (!trustLevel.isMetBy(quorum.votingPowerSigned(), quorum.totalVotingPower())) {
            throw new LightClientException(ErrorCode.INSUFFICIENT_VOTING_POWER, untrusted.height(),
                    "valid signatures hold " + quorum.votingPowerSigned() + " of " + quorum.totalVotingPower()
                            + " voting power, below trust level " + trustLevel);
        }
    }

    private void bisect(LightBlock trusted,
                        LightBlock untrusted,
                        TrustLevel trustLevel,
                        Instant latestAllowed,
                        int depth,
                        LightClientException shortfall) {
        if (depth >= maxBisectionDepth) {
            throw trustNotReached(untrusted.height(), "bisection depth " + maxBisectionDepth + " exhausted", shortfall);
        }
        long pivotHeight = trusted.height() + (untrusted.height() - trusted.height()) / 2;
        metrics.bisectionStep();
        LightBlock pivot = fetch(pivotHeight, untrusted.height(), shortfall);
        verify(trusted, pivot, trustLevel, latestAllowed, depth + 1);
        verify(pivot, untrusted, trustLevel, latestAllowed, depth + 1);
    }

    private LightBlock fetch(long height, long targetHeight, LightClientException shortfall) {
        Optional<LightBlock> block;
        try {
            block = provider.lightBlock(height);
        } catch (RuntimeException e) {
            metrics.providerFetch(false);
            LOG.log(Level.INFO, "Header provider failed at height " + height, e);
            LightClientException failure = noTrustPath(targetHeight, "header provider failed at height " + height, e);
            failure.addSuppressed(shortfall);
            throw failure;
        }
        if (block == null || block.isEmpty()) {
            metrics.providerFetch(false);
            throw trustNotReached(targetHeight, "no light block available at height " + height, shortfall);
        }
        metrics.providerFetch(true);
        if (block.get().height() != height) {
            throw noTrustPath(targetHeight, "provider answered height " + block.get().height()
                    + " for height " + height, shortfall);
        }
        return block.get();
    }

    private void checkOrdering(LightBlock trusted, LightBlock untrusted, Instant latestAllowed) {
        if (!untrusted.signedHeader().chainId().equals(trusted.signedHeader().chainId())) {
            throw new LightClientException(ErrorCode.CHAIN_ID_MISMATCH, untrusted.height(),
                    "header is for chain " + untrusted.signedHeader().chainId()
                            + ", trusted chain is " + trusted.signedHeader().chainId());
        }
        if (untrusted.height() <= trusted.height()) {
            throw new LightClientException(ErrorCode.NON_MONOTONIC_HEIGHT, untrusted.height(),
                    "height not above trusted height " + trusted.height());
        }
        if (!untrusted.signedHeader().time().isAfter(trusted.signedHeader().time())) {
            throw new LightClientException(ErrorCode.NON_MONOTONIC_TIMESTAMP, untrusted.height(),
                    "time " + untrusted.signedHeader().time() + " not after trusted time " + trusted.signedHeader().time());
        }
        if (untrusted.signedHeader().time().isAfter(latestAllowed)) {
            throw new LightClientException(ErrorCode.HEADER_FROM_FUTURE, untrusted.height(),
                    "time " + untrusted.signedHeader().time() + " is past now plus max clock drift (" + latestAllowed + ")");
        }
    }

    private void checkIdentity(LightBlock trusted, LightBlock untrusted) {
        SignedHeader header = untrusted.signedHeader();
        if (!Arrays.equals(untrusted.validatorSet().hash(hasher), header.header().validatorsHash())) {
            throw new LightClientException(ErrorCode.VALIDATOR_SET_MISMATCH, untrusted.height(),
                    "validator set hashes to " + Hex.shortHex(untrusted.validatorSet().hash(hasher))
                            + ", header commits to " + Hex.shortHex(header.header().validatorsHash()));
        }
        try {
            header.validateBasic(trusted.signedHeader().chainId(), hasher);
        } catch (IllegalArgumentException e) {
            throw new LightClientException(ErrorCode.INVALID_COMMIT, untrusted.height(), e.getMessage(), e);
        }
    }

    private static boolean isAdjacent(LightBlock trusted, LightBlock untrusted) {
        return untrusted.height() == trusted.height() + 1;
    }

    /** No intermediate header closed the gap: the trust-level shortfall stands. */
    private static LightClientException trustNotReached(long height, String reason, LightClientException shortfall) {
        return new LightClientException(ErrorCode.INSUFFICIENT_VOTING_POWER, height,
                "trust level not reached by bisection, " + reason, shortfall);
    }

    private static LightClientException noTrustPath(long height, String message, Throwable cause) {
        return new LightClientException(ErrorCode.NO_TRUST_PATH, height, message, cause);
    }
}
