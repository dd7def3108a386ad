package io.lightclient.core.storage;

import io.lightclient.core.client.ClientStateCodec;
import io.lightclient.core.client.ConsensusState;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent ConsensusStateStore using RocksDB.
 *
 * Layout (column families):
 *  - "consensus" : key = height(8, big-endian), val = consensus state json
 *  - "meta"      : key = "latest",              val = height(8, big-endian)
 *
 * Big-endian keys keep iteration in height order for the positive heights stored here.
 */
public final class RocksDBConsensusStateStore implements ConsensusStateStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBConsensusStateStore.class.getName());
    private static final byte[] LATEST = "latest".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfConsensus;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;
    private final ClientStateCodec codec;

    private RocksDBConsensusStateStore(RocksDB db,
                                       List<ColumnFamilyHandle> handles,
                                       DBOptions dbOptions,
                                       ClientStateCodec codec) {
        this.db = db;
        this.cfDefault = handles.get(0);
        this.cfConsensus = handles.get(1);
        this.cfMeta = handles.get(2);
        this.dbOptions = dbOptions;
        this.codec = codec;
    }

    /** Open or create a store in {@code dataDir}. */
    public static RocksDBConsensusStateStore open(String dataDir, ClientStateCodec codec) {
        if (codec == null) throw new IllegalArgumentException("codec required");
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> descriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("consensus".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8)));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, descriptors, handles);
            LOG.info(() -> "Opened consensus state store at " + dataDir);
            return new RocksDBConsensusStateStore(db, handles, dbOpts, codec);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized void put(ConsensusState state) {
        if (state == null) throw new IllegalArgumentException("consensus state required");
        byte[] key = longToBytes(state.height());
        try {
            byte[] existing = db.get(cfConsensus, key);
            if (existing != null) {
                if (codec.consensusStateFromBytes(existing).equals(state)) return;
                throw new IllegalArgumentException("conflicting consensus state at height " + state.height());
            }
            try (WriteOptions wo = new WriteOptions().setSync(true);
                 WriteBatch batch = new WriteBatch()) {
                batch.put(cfConsensus, key, codec.consensusStateToBytes(state));
                byte[] latest = db.get(cfMeta, LATEST);
                if (latest == null || bytesToLong(latest) < state.height()) {
                    batch.put(cfMeta, LATEST, key);
                }
                db.write(wo, batch);
            }
        } catch (RocksDBException e) {
            throw new IllegalStateException("put consensus state failed at height " + state.height(), e);
        }
    }

    @Override
    public synchronized Optional<ConsensusState> get(long height) {
        try {
            byte[] body = db.get(cfConsensus, longToBytes(height));
            return body == null ? Optional.empty() : Optional.of(codec.consensusStateFromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("get consensus state failed at height " + height, e);
        }
    }

    @Override
    public synchronized Optional<ConsensusState> latest() {
        try {
            byte[] latest = db.get(cfMeta, LATEST);
            return latest == null ? Optional.empty() : get(bytesToLong(latest));
        } catch (RocksDBException e) {
            throw new IllegalStateException("get latest consensus state failed", e);
        }
    }

    @Override
    public synchronized List<Long> heights() {
        List<Long> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfConsensus)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(bytesToLong(it.key()));
            }
        }
        return out;
    }

    @Override
    public synchronized long size() {
        return heights().size();
    }

    @Override
    public synchronized void close() {
        cfConsensus.close();
        cfMeta.close();
        cfDefault.close();
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "Closing consensus state store failed", e);
        } finally {
            dbOptions.close();
        }
    }

    private static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(Long.BYTES).putLong(v).array();
    }

    private static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }
}
