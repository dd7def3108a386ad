package io.lightclient.core.protocol;

import io.lightclient.core.TestChain;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorSetTest {

    @Test
    void ordersByAddressAndSumsPower() {
        TestChain.Committee committee = TestChain.committee(5, 7, 11);
        ValidatorSet set = committee.set();

        assertEquals(3, set.size());
        assertEquals(23L, set.totalVotingPower());
        for (int i = 1; i < set.size(); i++) {
            assertTrue(set.get(i - 1).address().compareTo(set.get(i).address()) < 0);
        }
    }

    @Test
    void votingPowerInIgnoresUnknownAddresses() {
        ValidatorSet set = TestChain.committee(5, 7).set();
        String known = set.get(0).address();
        String stranger = SignatureUtil.deriveAddress(TestChain.newKeyPair().getPublic());

        assertEquals(set.get(0).votingPower(), set.votingPowerIn(Set.of(known, stranger)));
        assertEquals(0L, set.votingPowerIn(Set.of(stranger)));
        assertEquals(0L, set.votingPowerIn(null));
    }

    @Test
    void rejectsEmptyAndDuplicateMembers() {
        KeyPair kp = TestChain.newKeyPair();
        Validator v = new Validator(kp.getPublic(), 10);

        assertThrows(IllegalArgumentException.class, () -> new ValidatorSet(List.of()));
        assertThrows(IllegalArgumentException.class, () -> ValidatorSet.of(v, new Validator(kp.getPublic(), 3)));
    }

    @Test
    void validatorRejectsForeignAddressAndNonPositivePower() {
        KeyPair a = TestChain.newKeyPair();
        KeyPair b = TestChain.newKeyPair();
        String addressOfB = SignatureUtil.deriveAddress(b.getPublic());

        assertThrows(IllegalArgumentException.class, () -> new Validator(addressOfB, a.getPublic(), 1));
        assertThrows(IllegalArgumentException.class, () -> new Validator(a.getPublic(), 0));
        assertThrows(IllegalArgumentException.class, () -> new Validator(a.getPublic(), -4));
    }

    @Test
    void totalPowerIsCapped() {
        long tooMuch = ProtocolLimits.MAX_TOTAL_VOTING_POWER / 2 + 1;
        Validator a = new Validator(TestChain.newKeyPair().getPublic(), tooMuch);
        Validator b = new Validator(TestChain.newKeyPair().getPublic(), tooMuch);

        assertThrows(IllegalArgumentException.class, () -> ValidatorSet.of(a, b));
    }

    @Test
    void hashIsOrderIndependentButTracksPower() {
        KeyPair a = TestChain.newKeyPair();
        KeyPair b = TestChain.newKeyPair();
        ValidatorSet ab = ValidatorSet.of(new Validator(a.getPublic(), 1), new Validator(b.getPublic(), 2));
        ValidatorSet ba = ValidatorSet.of(new Validator(b.getPublic(), 2), new Validator(a.getPublic(), 1));
        ValidatorSet changed = ValidatorSet.of(new Validator(a.getPublic(), 1), new Validator(b.getPublic(), 3));

        assertArrayEquals(ab.hash(Hashes.SHA256), ba.hash(Hashes.SHA256));
        assertEquals(ab, ba);
        assertFalse(java.util.Arrays.equals(ab.hash(Hashes.SHA256), changed.hash(Hashes.SHA256)));
        assertEquals(Hashes.SHA256_LENGTH, ab.hash(Hashes.SHA256).length);
    }
}
