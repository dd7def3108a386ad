package io.lightclient.core;

import io.lightclient.core.protocol.BlockHeader;
import io.lightclient.core.protocol.BlockId;
import io.lightclient.core.protocol.Commit;
import io.lightclient.core.protocol.CommitSig;
import io.lightclient.core.protocol.Hashes;
import io.lightclient.core.protocol.Header;
import io.lightclient.core.protocol.SignatureUtil;
import io.lightclient.core.protocol.SignedHeader;
import io.lightclient.core.protocol.Validator;
import io.lightclient.core.protocol.ValidatorSet;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongFunction;
import java.util.function.Predicate;

/**
 * Builds Ed25519 committees and fully signed headers for arbitrary heights.
 */
public final class TestChain {
    public static final String CHAIN_ID = "test-chain";
    public static final Instant GENESIS = Instant.parse("2024-01-01T00:00:00Z");

    private TestChain() {
    }

    /** Validator keys with their private halves, so the set can sign commits. */
    public static final class Committee {
        private final ValidatorSet set;
        private final Map<String, PrivateKey> keys;

        private Committee(ValidatorSet set, Map<String, PrivateKey> keys) {
            this.set = set;
            this.keys = keys;
        }

        public ValidatorSet set() {
            return set;
        }

        public PrivateKey key(String address) {
            PrivateKey key = keys.get(address);
            if (key == null) throw new IllegalArgumentException("not a member: " + address);
            return key;
        }

        public Validator validator(int index) {
            return set.get(index);
        }
    }

    public static Committee committee(long... powers) {
        List<Validator> validators = new ArrayList<>();
        Map<String, PrivateKey> keys = new HashMap<>();
        for (long power : powers) {
            KeyPair kp = newKeyPair();
            Validator v = new Validator(kp.getPublic(), power);
            validators.add(v);
            keys.put(v.address(), kp.getPrivate());
        }
        return new Committee(new ValidatorSet(validators), keys);
    }

    public static Committee equalPower(int size) {
        long[] powers = new long[size];
        java.util.Arrays.fill(powers, 10L);
        return committee(powers);
    }

    /** Members of every part; keys carried over. */
    public static Committee union(Committee... parts) {
        List<Validator> validators = new ArrayList<>();
        Map<String, PrivateKey> keys = new HashMap<>();
        for (Committee part : parts) {
            validators.addAll(part.set.validators());
            keys.putAll(part.keys);
        }
        return new Committee(new ValidatorSet(validators), keys);
    }

    /** Members at {@code indices} of {@code committee}, in address order. */
    public static Committee subset(Committee committee, int... indices) {
        List<Validator> validators = new ArrayList<>();
        for (int i : indices) {
            validators.add(committee.validator(i));
        }
        return new Committee(new ValidatorSet(validators), committee.keys);
    }

    public static KeyPair newKeyPair() {
        try {
            return KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Ten seconds per block from {@link #GENESIS}. */
    public static Instant time(long height) {
        return GENESIS.plusSeconds(height * 10);
    }

    public static Header header(long height, Committee vals, Committee next) {
        return header(CHAIN_ID, height, time(height), vals, next, v -> true);
    }

    public static Header header(long height, Instant time, Committee vals, Committee next) {
        return header(CHAIN_ID, height, time, vals, next, v -> true);
    }

    public static Header header(String chainId, long height, Instant time, Committee vals, Committee next,
                                Predicate<Validator> signs) {
        BlockHeader blockHeader = blockHeader(chainId, height, time, vals.set(), next.set());
        Commit commit = sign(chainId, blockHeader, vals, signs);
        return new Header(new SignedHeader(blockHeader, commit), vals.set(), next.set());
    }

    public static BlockHeader blockHeader(String chainId, long height, Instant time, ValidatorSet vals, ValidatorSet next) {
        return BlockHeader.builder()
                .chainId(chainId)
                .height(height)
                .time(time)
                .lastCommitHash(bytes("last-commit", height))
                .dataHash(bytes("data", height))
                .validatorsHash(vals.hash(Hashes.SHA256))
                .nextValidatorsHash(next.hash(Hashes.SHA256))
                .consensusHash(bytes("consensus", 0))
                .appHash(bytes("app", height))
                .lastResultsHash(bytes("results", height))
                .evidenceHash(new byte[0])
                .proposerAddress(vals.get(0).address())
                .build();
    }

    /** Commit aligned with {@code vals}; members rejected by {@code signs} are absent. */
    public static Commit sign(String chainId, BlockHeader header, Committee vals, Predicate<Validator> signs) {
        BlockId blockId = blockIdOf(header);
        Instant ts = header.time();
        List<CommitSig> unsigned = new ArrayList<>();
        for (Validator v : vals.set().validators()) {
            unsigned.add(signs.test(v) ? CommitSig.forBlock(v.address(), ts, new byte[64]) : CommitSig.absent());
        }
        Commit draft = new Commit(header.height(), 0, blockId, unsigned);
        List<CommitSig> signed = new ArrayList<>();
        for (int i = 0; i < unsigned.size(); i++) {
            CommitSig slot = unsigned.get(i);
            if (slot.isAbsent()) {
                signed.add(slot);
                continue;
            }
            byte[] signature = SignatureUtil.sign(draft.voteSignBytes(chainId, i), vals.key(slot.validatorAddress()));
            signed.add(CommitSig.forBlock(slot.validatorAddress(), ts, signature));
        }
        return new Commit(header.height(), 0, blockId, signed);
    }

    public static BlockId blockIdOf(BlockHeader header) {
        return new BlockId(header.hash(Hashes.SHA256), 1, bytes("parts", header.height()));
    }

    /**
     * Headers {@code from..to} inclusive, height h signed by {@code committeeAt(h)} and
     * naming {@code committeeAt(h + 1)} as next.
     */
    public static List<Header> chain(long from, long to, LongFunction<Committee> committeeAt) {
        List<Header> out = new ArrayList<>();
        for (long h = from; h <= to; h++) {
            out.add(header(h, committeeAt.apply(h), committeeAt.apply(h + 1)));
        }
        return out;
    }

    private static byte[] bytes(String label, long height) {
        return Hashes.sha256((label + ":" + height).getBytes(StandardCharsets.UTF_8));
    }
}
