package io.lightclient.core.protocol;

import io.lightclient.core.TestChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignedHeaderTest {

    @Test
    void commitMustBeForThisHeader() {
        TestChain.Committee vals = TestChain.equalPower(3);
        Header header = TestChain.header(5, vals, vals);
        Header other = TestChain.header(6, vals, vals);

        assertDoesNotThrow(() -> header.signedHeader().validateBasic(TestChain.CHAIN_ID, Hashes.SHA256));

        SignedHeader swapped = new SignedHeader(header.signedHeader().header(), other.signedHeader().commit());
        assertThrows(IllegalArgumentException.class, () -> swapped.validateBasic(TestChain.CHAIN_ID, Hashes.SHA256));
        assertThrows(IllegalArgumentException.class,
                () -> header.signedHeader().validateBasic("other-chain", Hashes.SHA256));
    }

    @Test
    void headerHashCoversEveryField() {
        TestChain.Committee vals = TestChain.equalPower(2);
        BlockHeader h = TestChain.header(3, vals, vals).signedHeader().header();
        byte[] base = h.hash(Hashes.SHA256);

        BlockHeader changedApp = h.toBuilder().appHash(new byte[]{1}).build();
        BlockHeader changedTime = h.toBuilder().time(h.time().plusNanos(1)).build();

        assertFalse(java.util.Arrays.equals(base, changedApp.hash(Hashes.SHA256)));
        assertFalse(java.util.Arrays.equals(base, changedTime.hash(Hashes.SHA256)));
        assertArrayEquals(base, h.toBuilder().build().hash(Hashes.SHA256));
    }

    @Test
    void headerRejectsMissingOrOversizedFields() {
        TestChain.Committee vals = TestChain.equalPower(1);
        BlockHeader h = TestChain.header(3, vals, vals).signedHeader().header();

        assertThrows(IllegalArgumentException.class, () -> h.toBuilder().height(0).build());
        assertThrows(IllegalArgumentException.class, () -> h.toBuilder().chainId(" ").build());
        assertThrows(IllegalArgumentException.class, () -> h.toBuilder().chainId("c".repeat(51)).build());
        assertThrows(IllegalArgumentException.class, () -> h.toBuilder().validatorsHash(new byte[0]).build());
        assertThrows(IllegalArgumentException.class, () -> h.toBuilder().appHash(new byte[65]).build());
        assertThrows(IllegalArgumentException.class, () -> h.toBuilder().proposerAddress("abcd").build());
    }

    @Test
    void nilVotesSignAnEmptyBlockId() {
        TestChain.Committee vals = TestChain.equalPower(2);
        Commit commit = TestChain.header(4, vals, vals).signedHeader().commit();
        CommitSig first = commit.signatures().get(0);
        Commit withNil = new Commit(commit.height(), commit.round(), commit.blockId(), List.of(
                CommitSig.forNil(first.validatorAddress(), first.timestamp(), first.signature()),
                commit.signatures().get(1)));

        assertFalse(java.util.Arrays.equals(commit.voteSignBytes(TestChain.CHAIN_ID, 0),
                withNil.voteSignBytes(TestChain.CHAIN_ID, 0)));
        assertFalse(java.util.Arrays.equals(commit.voteSignBytes(TestChain.CHAIN_ID, 0),
                commit.voteSignBytes("other-chain", 0)));
    }

    @Test
    void commitNeedsABlockAndSignatures() {
        TestChain.Committee vals = TestChain.equalPower(1);
        Commit commit = TestChain.header(4, vals, vals).signedHeader().commit();

        assertThrows(IllegalArgumentException.class,
                () -> new Commit(4, 0, BlockId.empty(), commit.signatures()));
        assertThrows(IllegalArgumentException.class,
                () -> new Commit(4, 0, commit.blockId(), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new Commit(4, -1, commit.blockId(), commit.signatures()));
    }
}
