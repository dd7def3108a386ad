package io.lightclient.core.client;

import io.lightclient.core.consensus.ErrorCode;
import io.lightclient.core.consensus.LightClientException;
import io.lightclient.core.consensus.TrustVerifier;
import io.lightclient.core.protocol.Hex;
import io.lightclient.core.protocol.Header;
import io.lightclient.core.protocol.MerkleRoot;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a candidate header to a client state. Cheap temporal checks run first and never
 * touch cryptography; only then is the header handed to the {@link TrustVerifier}.
 * Stateless: the caller owns the client state and serializes updates to it.
 */
public final class ClientStateMachine {
    private static final Logger LOG = Logger.getLogger(ClientStateMachine.class.getName());

    private final TrustVerifier verifier;

    public ClientStateMachine(TrustVerifier verifier) {
        if (verifier == null) throw new IllegalArgumentException("verifier required");
        this.verifier = verifier;
    }

    public UpdateResult applyUpdate(ClientState clientState, Header candidate, Instant now) {
        if (clientState == null) throw new IllegalArgumentException("client state required");
        if (candidate == null) throw new IllegalArgumentException("candidate header required");
        if (now == null) throw new IllegalArgumentException("now required");
        try {
            checkValidity(clientState, candidate, now);
        } catch (LightClientException e) {
            logRejection(e);
            throw e;
        }
        ClientState updated = clientState.withLatestHeader(candidate);
        ConsensusState consensusState = consensusStateOf(candidate);
        LOG.info(() -> "Client for " + clientState.chainId() + " advanced " + clientState.latestHeight()
                + " -> " + candidate.height() + " (root " + Hex.shortHex(consensusState.root().bytes()) + ")");
        return new UpdateResult(updated, consensusState);
    }

    /** Consensus state a verified header derives. */
    public ConsensusState consensusStateOf(Header header) {
        return new ConsensusState(
                header.height(),
                header.time(),
                MerkleRoot.of(header.signedHeader().header().appHash()),
                header.nextValidatorSet().hash(verifier.hasher()));
    }

    private void checkValidity(ClientState clientState, Header candidate, Instant now) {
        long height = candidate.height();
        if (clientState.frozen()) {
            throw new LightClientException(ErrorCode.CLIENT_FROZEN, height,
                    "client for " + clientState.chainId() + " is frozen");
        }

        Instant latest = clientState.latestTimestamp();
        Duration trustingPeriod = clientState.trustingPeriod();
        Duration sinceTrusted = Duration.between(latest, now);
        if (sinceTrusted.compareTo(trustingPeriod) >= 0) {
            throw new LightClientException(ErrorCode.TRUSTING_PERIOD_EXPIRED, height,
                    "now minus latest trusted timestamp is " + sinceTrusted + ", trusting period is " + trustingPeriod);
        }
        Duration headerAge = Duration.between(latest, candidate.time());
        if (headerAge.compareTo(trustingPeriod) >= 0) {
            throw new LightClientException(ErrorCode.HEADER_OUTSIDE_TRUSTING_PERIOD, height,
                    "header time is " + headerAge + " past latest trusted timestamp, trusting period is " + trustingPeriod);
        }
        if (!candidate.time().isAfter(latest)) {
            throw new LightClientException(ErrorCode.NON_MONOTONIC_TIMESTAMP, height,
                    "header time " + candidate.time() + " <= latest trusted time " + latest);
        }
        if (height <= clientState.latestHeight()) {
            throw new LightClientException(ErrorCode.NON_MONOTONIC_HEIGHT, height,
                    "header height " + height + " <= latest trusted height " + clientState.latestHeight());
        }
        Instant latestAllowed = now.plus(clientState.maxClockDrift());
        if (candidate.time().isAfter(latestAllowed)) {
            throw new LightClientException(ErrorCode.HEADER_FROM_FUTURE, height,
                    "header time " + candidate.time() + " is past now plus max clock drift (" + latestAllowed + ")");
        }
        if (!clientState.chainId().equals(candidate.chainId())) {
            throw new LightClientException(ErrorCode.CHAIN_ID_MISMATCH, height,
                    "header is for chain " + candidate.chainId() + ", client tracks " + clientState.chainId());
        }

        Header trusted = clientState.latestHeader();
        verifier.verify(
                trusted.signedHeader(), trusted.validatorSet(),
                candidate.signedHeader(), candidate.validatorSet(),
                clientState.trustLevel(), now, clientState.maxClockDrift());

        if (!candidate.nextValidatorSetMatches(verifier.hasher())) {
            throw new LightClientException(ErrorCode.VALIDATOR_SET_MISMATCH, height,
                    "next validator set does not hash to the header's next validators hash");
        }
    }

    private static void logRejection(LightClientException e) {
        switch (e.category()) {
            case CRYPTO_VERIFICATION_FAILURE:
                LOG.warning(() -> "Header failed verification, possible attack: " + e.getMessage());
                break;
            case PROVIDER_FAILURE:
                LOG.log(Level.INFO, "No trust path: " + e.getMessage(), e.getCause());
                break;
            default:
                LOG.fine(() -> "Update rejected: " + e.getMessage());
                break;
        }
    }
}
