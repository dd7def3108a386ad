package io.lightclient.core.consensus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrustLevelTest {

    @Test
    void parsesFractions() {
        assertEquals(TrustLevel.ONE_THIRD, TrustLevel.parse("1/3"));
        assertEquals(new TrustLevel(3, 4), TrustLevel.parse(" 3 / 4 "));
        assertEquals("2/3", TrustLevel.TWO_THIRDS.toString());
    }

    @Test
    void rejectsFractionsOutsideZeroToOne() {
        assertThrows(IllegalArgumentException.class, () -> TrustLevel.parse("0/3"));
        assertThrows(IllegalArgumentException.class, () -> TrustLevel.parse("4/3"));
        assertThrows(IllegalArgumentException.class, () -> TrustLevel.parse("1/0"));
        assertThrows(IllegalArgumentException.class, () -> TrustLevel.parse("half"));
        assertThrows(IllegalArgumentException.class, () -> TrustLevel.parse(null));
    }

    @Test
    void thresholdIsInclusive() {
        assertTrue(TrustLevel.TWO_THIRDS.isMetBy(20, 30));
        assertFalse(TrustLevel.TWO_THIRDS.isMetBy(19, 30));
        assertTrue(TrustLevel.ONE_THIRD.isMetBy(10, 30));
        assertFalse(TrustLevel.ONE_THIRD.isMetBy(9, 30));
        assertFalse(TrustLevel.ONE_THIRD.isMetBy(0, 0));
    }

    @Test
    void largePowersDoNotOverflow() {
        long total = Long.MAX_VALUE / 8;
        long twoThirds = total / 3 * 2 + 1;
        assertTrue(TrustLevel.TWO_THIRDS.isMetBy(twoThirds, total));
        assertFalse(TrustLevel.TWO_THIRDS.isMetBy(total / 2, total));
    }
}
