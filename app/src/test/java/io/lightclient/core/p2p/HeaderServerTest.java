package io.lightclient.core.p2p;

import io.lightclient.core.TestChain;
import io.lightclient.core.client.ClientState;
import io.lightclient.core.client.ConsensusState;
import io.lightclient.core.client.LightClient;
import io.lightclient.core.client.LightClientConfig;
import io.lightclient.core.metrics.VerificationMetrics;
import io.lightclient.core.protocol.Header;
import io.lightclient.core.protocol.LightBlock;
import io.lightclient.core.protocol.LightBlockCodec;
import io.lightclient.core.provider.HeaderProvider;
import io.lightclient.core.provider.InMemoryHeaderProvider;
import io.lightclient.core.provider.ProviderException;
import io.lightclient.core.storage.InMemoryConsensusStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HeaderServerTest {

    private final LightBlockCodec codec = new LightBlockCodec();
    private final List<HeaderServer> servers = new CopyOnWriteArrayList<>();
    private final List<AutoCloseable> closeables = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        for (AutoCloseable c : closeables) {
            try {
                c.close();
            } catch (Exception ignored) {
            }
        }
        for (HeaderServer server : servers) {
            try {
                server.stop();
            } catch (Exception ignored) {
            }
        }
    }

    @Test
    void servesStoredLightBlocks() throws Exception {
        TestChain.Committee vals = TestChain.committee(3, 4, 5);
        Header header = TestChain.header(8, vals, vals);
        HeaderServer server = start(new InMemoryHeaderProvider(List.of(header.lightBlock())));
        HeaderClient client = client("127.0.0.1:" + server.port(), 5_000);

        Optional<LightBlock> fetched = client.lightBlock(8);

        assertTrue(fetched.isPresent());
        assertEquals(header.lightBlock(), fetched.get());
        assertTrue(client.lightBlock(9).isEmpty());
        assertEquals(header.lightBlock(), client.lightBlock(8).orElseThrow(), "connection is reused");
    }

    @Test
    void providerErrorsReachTheClient() throws Exception {
        HeaderServer server = start(height -> {
            throw new ProviderException("archive offline");
        });
        HeaderClient client = client("127.0.0.1:" + server.port(), 5_000);

        ProviderException ex = assertThrows(ProviderException.class, () -> client.lightBlock(3));
        assertTrue(ex.getMessage().contains("archive offline"));
    }

    @Test
    void silentProviderTimesOut() throws Exception {
        try (ServerSocket silent = new ServerSocket(0)) {
            Thread acceptor = new Thread(() -> {
                try (Socket ignored = silent.accept()) {
                    Thread.sleep(5_000);
                } catch (IOException | InterruptedException ignored) {
                }
            }, "silent-provider");
            acceptor.setDaemon(true);
            acceptor.start();
            HeaderClient client = client("127.0.0.1:" + silent.getLocalPort(), 200);

            long started = System.nanoTime();
            assertThrows(ProviderException.class, () -> client.lightBlock(5));
            assertTrue(System.nanoTime() - started < 4_000_000_000L);
            acceptor.interrupt();
        }
    }

    @Test
    void unreachableProviderFails() throws Exception {
        int port = freePort();
        HeaderClient client = client("127.0.0.1:" + port, 1_000);

        assertThrows(ProviderException.class, () -> client.lightBlock(1));
    }

    @Test
    void rejectsMalformedEndpoints() {
        assertThrows(IllegalArgumentException.class, () -> HeaderClient.connectTo("localhost", 100, codec));
        assertThrows(IllegalArgumentException.class, () -> HeaderClient.connectTo("localhost:http", 100, codec));
        assertThrows(IllegalArgumentException.class, () -> HeaderClient.connectTo(":80", 100, codec));
    }

    @Test
    void lightClientBisectsThroughARemoteProvider() throws Exception {
        TestChain.Committee a = TestChain.equalPower(4);
        TestChain.Committee b = TestChain.equalPower(4);
        List<Header> chain = TestChain.chain(1, 64, h -> h <= 20 ? a : b);
        InMemoryHeaderProvider archive = new InMemoryHeaderProvider();
        chain.forEach(h -> archive.put(h.lightBlock()));
        HeaderServer server = start(archive);
        HeaderClient remote = client("127.0.0.1:" + server.port(), 5_000);
        Header target = chain.get(63);
        VerificationMetrics metrics = new VerificationMetrics();
        LightClient client = LightClient.create(
                ClientState.initial(TestChain.CHAIN_ID, chain.get(0), LightClientConfig.defaultLocal()),
                LightClientConfig.defaultLocal(), remote, new InMemoryConsensusStateStore(),
                Clock.fixed(target.time(), ZoneOffset.UTC), metrics);

        ConsensusState accepted = client.update(target);

        assertEquals(64L, accepted.height());
        assertTrue(metrics.providerFetches() > 0);
    }

    private HeaderServer start(HeaderProvider provider) {
        HeaderServer server = new HeaderServer(0, provider, codec);
        servers.add(server);
        server.start();
        return server;
    }

    private HeaderClient client(String endpoint, long timeoutMillis) {
        HeaderClient client = HeaderClient.connectTo(endpoint, timeoutMillis, codec);
        closeables.add(client);
        return client;
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
