package io.lightclient.core.client;

import io.lightclient.core.consensus.LightClientException;
import io.lightclient.core.consensus.TrustVerifier;
import io.lightclient.core.metrics.VerificationMetrics;
import io.lightclient.core.protocol.Hashes;
import io.lightclient.core.protocol.Header;
import io.lightclient.core.protocol.SignatureVerifier;
import io.lightclient.core.provider.HeaderProvider;
import io.lightclient.core.storage.ConsensusStateStore;

import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Light client for one counterparty chain. Owns the current client state and applies
 * updates one at a time: verification reads the trust anchor and the new state is written
 * under the same lock, consensus state first, so a failed write leaves nothing behind.
 */
public final class LightClient {
    private static final Logger LOG = Logger.getLogger(LightClient.class.getName());

    private final ClientStateMachine machine;
    private final ConsensusStateStore store;
    private final Clock clock;
    private final VerificationMetrics metrics;
    private ClientState state;

    public LightClient(ClientState initial,
                       ClientStateMachine machine,
                       ConsensusStateStore store,
                       Clock clock,
                       VerificationMetrics metrics) {
        if (initial == null) throw new IllegalArgumentException("initial client state required");
        if (machine == null || store == null || clock == null || metrics == null) {
            throw new IllegalArgumentException("machine, store, clock and metrics required");
        }
        this.machine = machine;
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
        this.state = initial;
        ConsensusState anchor = machine.consensusStateOf(initial.latestHeader());
        if (store.get(anchor.height()).isEmpty()) {
            store.put(anchor);
        }
    }

    /** Wires a SHA-256 / JCA verifier over {@code provider} with settings from {@code config}. */
    public static LightClient create(ClientState initial,
                                     LightClientConfig config,
                                     HeaderProvider provider,
                                     ConsensusStateStore store,
                                     Clock clock,
                                     VerificationMetrics metrics) {
        TrustVerifier verifier = new TrustVerifier(Hashes.SHA256, SignatureVerifier.jca(), provider,
                config.maxBisectionDepth, metrics);
        return new LightClient(initial, new ClientStateMachine(verifier), store, clock, metrics);
    }

    public synchronized ClientState state() {
        return state;
    }

    /**
     * Verify {@code candidate} against the current trust anchor at the clock's current time
     * and, if it passes, make it the new anchor.
     *
     * @throws LightClientException if the candidate is rejected; the client is unchanged
     */
    public synchronized ConsensusState update(Header candidate) {
        ClientState current = state;
        UpdateResult result;
        try {
            result = metrics.recordUpdate(() -> machine.applyUpdate(current, candidate, clock.instant()));
        } catch (LightClientException e) {
            metrics.updateRejected(e.code());
            throw e;
        }
        store.put(result.consensusState());
        state = result.clientState();
        metrics.updateAccepted();
        return result.consensusState();
    }

    /** Called by misbehaviour handling; every later update fails with CLIENT_FROZEN. */
    public synchronized void freeze() {
        if (!state.frozen()) {
            LOG.warning(() -> "Freezing client for " + state.chainId() + " at height " + state.latestHeight());
            state = state.freeze();
        }
    }

    public Optional<ConsensusState> consensusState(long height) {
        return store.get(height);
    }

    public VerificationMetrics metrics() {
        return metrics;
    }
}
