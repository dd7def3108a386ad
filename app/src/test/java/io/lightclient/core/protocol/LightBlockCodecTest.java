package io.lightclient.core.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lightclient.core.TestChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LightBlockCodecTest {

    private final LightBlockCodec codec = new LightBlockCodec();

    @Test
    void decodedHeaderKeepsItsHashAndSignatures() {
        TestChain.Committee vals = TestChain.committee(3, 5, 8);
        TestChain.Committee next = TestChain.committee(4, 4);
        Header header = TestChain.header(12, vals, next);

        Header decoded = codec.headerFromJson(codec.headerToJson(header));

        assertEquals(header, decoded);
        assertArrayEquals(header.signedHeader().header().hash(Hashes.SHA256),
                decoded.signedHeader().header().hash(Hashes.SHA256));
        assertTrue(decoded.validatorSetMatches(Hashes.SHA256));
        assertTrue(decoded.nextValidatorSetMatches(Hashes.SHA256));
        Commit commit = decoded.signedHeader().commit();
        Validator signer = decoded.validatorSet().get(0);
        assertTrue(SignatureUtil.verify(commit.voteSignBytes(TestChain.CHAIN_ID, 0),
                commit.signatures().get(0).signature(), signer.publicKey()));
    }

    @Test
    void absentSlotsCarryNoFields() {
        TestChain.Committee vals = TestChain.equalPower(3);
        String skipped = vals.validator(1).address();
        Header header = TestChain.header(TestChain.CHAIN_ID, 2, TestChain.time(2), vals, vals,
                v -> !v.address().equals(skipped));

        ObjectNode json = codec.encodeSignedHeader(header.signedHeader());
        assertEquals(1, json.at("/commit/signatures/1").size());

        LightBlock block = codec.lightBlockFromJson(codec.lightBlockToJson(header.lightBlock()));
        assertTrue(block.signedHeader().commit().signatures().get(1).isAbsent());
        assertEquals(header.lightBlock(), block);
    }

    @Test
    void malformedInputIsRejected() {
        TestChain.Committee vals = TestChain.equalPower(1);
        ObjectNode json = codec.encodeHeader(TestChain.header(2, vals, vals));
        ObjectNode validator = (ObjectNode) json.at("/validatorSet/validators/0");
        validator.put("votingPower", "ten");

        IllegalArgumentException badType = assertThrows(IllegalArgumentException.class,
                () -> codec.headerFromJson(json.toString()));
        assertTrue(badType.getMessage().startsWith("Malformed header json"));

        for (String text : List.of("", "{", "[]", "{\"signedHeader\":{}}")) {
            assertThrows(IllegalArgumentException.class, () -> codec.headerFromJson(text), text);
        }
    }

    @Test
    void tamperedAddressFailsValidation() {
        TestChain.Committee vals = TestChain.equalPower(2);
        ObjectNode json = codec.encodeLightBlock(TestChain.header(2, vals, vals).lightBlock());
        ((ObjectNode) json.at("/validatorSet/validators/0")).put("address", vals.validator(1).address());

        assertThrows(IllegalArgumentException.class, () -> codec.lightBlockFromJson(json.toString()));
    }
}
