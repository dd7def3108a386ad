package io.lightclient.core.client;

import io.lightclient.core.TestChain;
import io.lightclient.core.consensus.ErrorCode;
import io.lightclient.core.consensus.LightClientException;
import io.lightclient.core.metrics.VerificationMetrics;
import io.lightclient.core.protocol.Header;
import io.lightclient.core.protocol.MerkleRoot;
import io.lightclient.core.provider.HeaderProvider;
import io.lightclient.core.storage.InMemoryConsensusStateStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.lightclient.core.TestChain.CHAIN_ID;
import static org.junit.jupiter.api.Assertions.*;

class LightClientTest {

    private final TestChain.Committee vals = TestChain.equalPower(4);
    private final Header anchor = TestChain.header(1, vals, vals);
    private final Header next = TestChain.header(2, vals, vals);
    private final Clock clock = Clock.fixed(next.time(), ZoneOffset.UTC);
    private final InMemoryConsensusStateStore store = new InMemoryConsensusStateStore();
    private final VerificationMetrics metrics = new VerificationMetrics();
    private final LightClient client = LightClient.create(
            ClientState.initial(CHAIN_ID, anchor, LightClientConfig.defaultLocal()),
            LightClientConfig.defaultLocal(), HeaderProvider.none(), store, clock, metrics);

    @Test
    void storesTheTrustAnchorOnCreation() {
        assertEquals(List.of(1L), store.heights());
        assertEquals(anchor.time(), client.consensusState(1).orElseThrow().timestamp());
    }

    @Test
    void acceptedUpdateIsPersistedAndCounted() {
        ConsensusState accepted = client.update(next);

        assertEquals(2L, accepted.height());
        assertEquals(2L, client.state().latestHeight());
        assertEquals(accepted, store.latest().orElseThrow());
        assertEquals(1.0, metrics.count("accepted", "none"));
        assertTrue(metrics.scrape().contains(VerificationMetrics.UPDATE_TIME));
    }

    @Test
    void rejectedUpdateLeavesTheClientUntouched() {
        String only = vals.validator(0).address();
        Header weak = TestChain.header(CHAIN_ID, 2, TestChain.time(2), vals, vals, v -> v.address().equals(only));

        assertThrows(LightClientException.class, () -> client.update(weak));

        assertEquals(1L, client.state().latestHeight());
        assertEquals(1L, store.size());
        assertEquals(1.0, metrics.count("rejected", ErrorCode.INSUFFICIENT_VOTING_POWER.name()));
    }

    @Test
    void brokenProviderIsCountedAsNoTrustPath() {
        TestChain.Committee successors = TestChain.equalPower(4);
        Header far = TestChain.header(40, successors, successors);
        HeaderProvider broken = height -> {
            throw new IllegalStateException("event loop terminated");
        };
        LightClient bisecting = LightClient.create(
                ClientState.initial(CHAIN_ID, anchor, LightClientConfig.defaultLocal()),
                LightClientConfig.defaultLocal(), broken, new InMemoryConsensusStateStore(),
                Clock.fixed(far.time(), ZoneOffset.UTC), metrics);

        LightClientException ex = assertThrows(LightClientException.class, () -> bisecting.update(far));

        assertEquals(ErrorCode.NO_TRUST_PATH, ex.code());
        assertEquals(1L, bisecting.state().latestHeight());
        assertEquals(1.0, metrics.count("rejected", ErrorCode.NO_TRUST_PATH.name()));
    }

    @Test
    void failedPersistenceDoesNotAdvanceTheClient() {
        store.put(new ConsensusState(2, next.time(), MerkleRoot.of(new byte[]{9}), new byte[]{1}));

        assertThrows(IllegalArgumentException.class, () -> client.update(next));
        assertEquals(1L, client.state().latestHeight());
    }

    @Test
    void frozenClientRejectsUpdates() {
        client.freeze();

        LightClientException ex = assertThrows(LightClientException.class, () -> client.update(next));
        assertEquals(ErrorCode.CLIENT_FROZEN, ex.code());
        assertTrue(client.state().frozen());
    }

    @Test
    void concurrentUpdatesWithTheSameHeaderAcceptOnlyOne() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        Callable<ConsensusState> attempt = () -> {
            start.await();
            return client.update(next);
        };
        try {
            List<Future<ConsensusState>> futures = List.of(
                    pool.submit(attempt), pool.submit(attempt), pool.submit(attempt), pool.submit(attempt));
            start.countDown();
            int accepted = 0;
            int rejected = 0;
            for (Future<ConsensusState> f : futures) {
                try {
                    f.get(10, TimeUnit.SECONDS);
                    accepted++;
                } catch (ExecutionException e) {
                    assertInstanceOf(LightClientException.class, e.getCause());
                    rejected++;
                }
            }
            assertEquals(1, accepted);
            assertEquals(3, rejected);
            assertEquals(2L, client.state().latestHeight());
        } finally {
            pool.shutdownNow();
        }
    }
}
