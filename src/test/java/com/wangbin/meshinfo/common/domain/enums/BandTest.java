package com.wangbin.meshinfo.common.domain.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BandTest {

    @Test
    void radioOffWinsOverChannel() {
        assertEquals(Band.OFF, Band.resolve("off", null, "149"));
        assertEquals(Band.OFF, Band.resolve(null, null, "6"));
    }

    @Test
    void nineHundredBoardsAreDetectedByBoardId() {
        assertEquals(Band.NINE_HUNDRED_MHZ, Band.resolve("on", "0xe009", "5"));
    }

    @Test
    void channelSelectsBand() {
        assertEquals(Band.TWO_GHZ, Band.resolve("on", null, "-2"));
        assertEquals(Band.TWO_GHZ, Band.resolve("on", null, "11"));
        assertEquals(Band.THREE_GHZ, Band.resolve("on", null, "84"));
        assertEquals(Band.THREE_GHZ, Band.resolve("on", null, "3420"));
        assertEquals(Band.FIVE_GHZ, Band.resolve("on", null, "149"));
        assertEquals(Band.UNKNOWN, Band.resolve("on", null, "0"));
        assertEquals(Band.UNKNOWN, Band.resolve("on", null, null));
    }
}
