package io.lightclient.core;

import io.lightclient.core.client.ClientState;
import io.lightclient.core.client.ClientStateCodec;
import io.lightclient.core.client.ConsensusState;
import io.lightclient.core.client.LightClient;
import io.lightclient.core.client.LightClientConfig;
import io.lightclient.core.consensus.LightClientException;
import io.lightclient.core.consensus.TrustLevel;
import io.lightclient.core.metrics.VerificationMetrics;
import io.lightclient.core.p2p.HeaderClient;
import io.lightclient.core.p2p.HeaderServer;
import io.lightclient.core.protocol.Header;
import io.lightclient.core.protocol.LightBlock;
import io.lightclient.core.protocol.LightBlockCodec;
import io.lightclient.core.provider.HeaderProvider;
import io.lightclient.core.provider.InMemoryHeaderProvider;
import io.lightclient.core.storage.ConsensusStateStore;
import io.lightclient.core.storage.InMemoryConsensusStateStore;
import io.lightclient.core.storage.RocksDBConsensusStateStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_REJECTED = 2;

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(EXIT_USAGE);
            }
            return;
        }
        LightBlockCodec blocks = new LightBlockCodec();
        if (options.serveMode()) {
            serve(options, blocks);
            return;
        }
        int code = update(options, blocks);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int update(CliOptions options, LightBlockCodec blocks) throws IOException {
        ClientStateCodec states = new ClientStateCodec(blocks);
        LightClientConfig config = LightClientConfig.defaultLocal()
                .withTrustLevel(options.trustLevel())
                .withProviderTimeoutMillis(options.providerTimeoutMillis());

        ClientState initial;
        if (options.clientState() != null) {
            initial = states.clientStateFromJson(read(options.clientState()));
        } else {
            Header anchor = blocks.headerFromJson(read(options.trustHeader()));
            initial = ClientState.initial(options.chainId(), anchor, config);
        }
        Header candidate = blocks.headerFromJson(read(options.header()));
        Clock clock = options.now() != null ? Clock.fixed(options.now(), ZoneOffset.UTC) : Clock.systemUTC();
        VerificationMetrics metrics = new VerificationMetrics();

        HeaderClient remote = options.provider() != null
                ? HeaderClient.connectTo(options.provider(), options.providerTimeoutMillis(), blocks)
                : null;
        HeaderProvider provider = remote != null ? remote : HeaderProvider.none();
        ConsensusStateStore store = options.storeDir() != null
                ? RocksDBConsensusStateStore.open(options.storeDir().toString(), states)
                : new InMemoryConsensusStateStore();
        try {
            LightClient client = LightClient.create(initial, config, provider, store, clock, metrics);
            ConsensusState accepted;
            try {
                accepted = client.update(candidate);
            } catch (LightClientException e) {
                System.err.println("Rejected: " + e.getMessage() + " [" + e.category() + "]");
                return EXIT_REJECTED;
            }
            String json = states.clientStateToJson(client.state());
            if (options.out() != null) {
                Files.writeString(options.out(), json, StandardCharsets.UTF_8);
                LOG.info(() -> "Wrote client state at height " + accepted.height() + " to " + options.out());
            } else {
                System.out.println(json);
            }
            LOG.info("=== Metrics ===\n" + metrics.scrape());
            return EXIT_OK;
        } finally {
            if (remote != null) {
                remote.close();
            }
            if (store instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) store).close();
                } catch (Exception e) {
                    LOG.log(Level.WARNING, "Closing consensus state store failed", e);
                }
            }
        }
    }

    static void serve(CliOptions options, LightBlockCodec blocks) throws IOException, InterruptedException {
        InMemoryHeaderProvider provider = new InMemoryHeaderProvider(loadLightBlocks(options.blocksDir(), blocks));
        LOG.info("Loaded " + provider.size() + " light blocks from " + options.blocksDir());
        HeaderServer server = new HeaderServer(options.servePort(), provider, blocks);
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "light-client-shutdown"));
        try {
            server.start();
            LOG.info("Serving light blocks. Press CTRL+C to exit.");
            shutdown.await();
        } finally {
            server.stop();
        }
    }

    static List<LightBlock> loadLightBlocks(Path dir, LightBlockCodec blocks) throws IOException {
        List<LightBlock> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files.filter(p -> p.toString().endsWith(".json")).sorted()::iterator) {
                try {
                    out.add(blocks.lightBlockFromJson(read(file)));
                } catch (IllegalArgumentException e) {
                    LOG.log(Level.WARNING, "Skipping unreadable light block " + file, e);
                }
            }
        }
        return out;
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path clientState,
            Path trustHeader,
            String chainId,
            Path header,
            Instant now,
            TrustLevel trustLevel,
            String provider,
            long providerTimeoutMillis,
            Path storeDir,
            Path out,
            int servePort,
            Path blocksDir
    ) {
        boolean serveMode() {
            return servePort > 0;
        }

        static CliOptions parse(String[] args) {
            LightClientConfig defaults = LightClientConfig.defaultLocal();
            Path clientState = null;
            Path trustHeader = null;
            String chainId = envOrDefault("LIGHT_CLIENT_CHAIN_ID", null);
            Path header = null;
            Instant now = null;
            TrustLevel trustLevel = defaults.trustLevel;
            String provider = envOrDefault("LIGHT_CLIENT_PROVIDER", null);
            long providerTimeoutMillis = defaults.providerTimeoutMillis;
            Path storeDir = envPath("LIGHT_CLIENT_STORE_DIR", null);
            Path out = null;
            int servePort = 0;
            Path blocksDir = envPath("LIGHT_CLIENT_BLOCKS_DIR", null);
            boolean showHelp = false;
            String error = null;

            try {
                String timeoutEnv = System.getenv("LIGHT_CLIENT_PROVIDER_TIMEOUT_MS");
                if (timeoutEnv != null && !timeoutEnv.isBlank()) {
                    providerTimeoutMillis = parsePositiveLong(timeoutEnv, "LIGHT_CLIENT_PROVIDER_TIMEOUT_MS");
                }
                String trustEnv = System.getenv("LIGHT_CLIENT_TRUST_LEVEL");
                if (trustEnv != null && !trustEnv.isBlank()) {
                    trustLevel = TrustLevel.parse(trustEnv);
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args == null || args.length == 0) {
                showHelp = true;
            } else {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--client-state=")) {
                            clientState = Path.of(value(arg));
                        } else if (arg.startsWith("--trust-header=")) {
                            trustHeader = Path.of(value(arg));
                        } else if (arg.startsWith("--chain-id=")) {
                            chainId = value(arg);
                        } else if (arg.startsWith("--header=")) {
                            header = Path.of(value(arg));
                        } else if (arg.startsWith("--now=")) {
                            now = parseInstant(value(arg));
                        } else if (arg.startsWith("--trust-level=")) {
                            trustLevel = TrustLevel.parse(value(arg));
                        } else if (arg.startsWith("--provider=")) {
                            provider = value(arg);
                        } else if (arg.startsWith("--provider-timeout-ms=")) {
                            providerTimeoutMillis = parsePositiveLong(value(arg), "--provider-timeout-ms");
                        } else if (arg.startsWith("--store-dir=")) {
                            storeDir = Path.of(value(arg));
                        } else if (arg.startsWith("--out=")) {
                            out = Path.of(value(arg));
                        } else if (arg.startsWith("--serve-port=")) {
                            servePort = parsePort(value(arg), "--serve-port");
                        } else if (arg.startsWith("--blocks-dir=")) {
                            blocksDir = Path.of(value(arg));
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            if (chainId != null && chainId.isBlank()) {
                chainId = null;
            }
            if (provider != null && provider.isBlank()) {
                provider = null;
            }
            if (error == null && !showHelp) {
                error = missingRequirement(clientState, trustHeader, chainId, header, servePort, blocksDir);
                if (error != null) {
                    showHelp = true;
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    clientState,
                    trustHeader,
                    chainId,
                    header,
                    now,
                    trustLevel,
                    provider,
                    providerTimeoutMillis,
                    storeDir,
                    out,
                    servePort,
                    blocksDir
            );
        }

        private static String missingRequirement(Path clientState, Path trustHeader, String chainId,
                                                 Path header, int servePort, Path blocksDir) {
            if (servePort > 0) {
                return blocksDir == null ? "--serve-port requires --blocks-dir" : null;
            }
            if (header == null) {
                return "--header is required";
            }
            if (clientState != null && trustHeader != null) {
                return "Use either --client-state or --trust-header, not both";
            }
            if (clientState == null && trustHeader == null) {
                return "--client-state or --trust-header is required";
            }
            if (trustHeader != null && chainId == null) {
                return "--trust-header requires --chain-id";
            }
            return null;
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: light-client [options]

Update mode:
  --client-state=<file>        Client state json to update
  --trust-header=<file>        Bootstrap a client from this trusted header json
  --chain-id=<id>              Chain id of the bootstrapped client
  --header=<file>              Candidate header json
  --now=<instant>              ISO-8601 evaluation time (default: system clock)
  --trust-level=<n/d>          Trust level for skipping verification (default 1/3)
  --provider=<host:port>       Remote header provider used for bisection
  --provider-timeout-ms=<ms>   Per-request provider timeout (default 5000)
  --store-dir=<path>           RocksDB consensus state store (default: in memory)
  --out=<file>                 Write the updated client state here (default: stdout)

Serve mode:
  --serve-port=<port>          Serve light blocks on this port until interrupted
  --blocks-dir=<dir>           Directory of light block *.json files to serve

  --help, -h                   Show this help message and exit

Environment overrides:
  LIGHT_CLIENT_CHAIN_ID              Default for --chain-id
  LIGHT_CLIENT_TRUST_LEVEL           Default for --trust-level
  LIGHT_CLIENT_PROVIDER              Default for --provider
  LIGHT_CLIENT_PROVIDER_TIMEOUT_MS   Default for --provider-timeout-ms
  LIGHT_CLIENT_STORE_DIR             Default for --store-dir
  LIGHT_CLIENT_BLOCKS_DIR            Default for --blocks-dir

Exit status: 0 accepted, 1 usage error, 2 header rejected.
""");
        }

        private static String value(String arg) {
            return arg.substring(arg.indexOf('=') + 1);
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static Instant parseInstant(String value) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid instant for --now: " + value);
            }
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
