package com.example.opcuaagent.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class MegolmRatchetTest {

    private static byte[] seed(long value) {
        byte[] seed = new byte[MegolmRatchet.LENGTH];
        new Random(value).nextBytes(seed);
        return seed;
    }

    private static MegolmRatchet steppedTo(MegolmRatchet start, long index) {
        MegolmRatchet ratchet = start.copy();
        while (ratchet.getIndex() < index) {
            ratchet.advance();
        }
        return ratchet;
    }

    @Test
    public void advanceToMatchesRepeatedAdvance() {
        MegolmRatchet start = MegolmRatchet.fromBytes(seed(1), 0);
        for (long target : new long[]{0, 1, 255, 256, 257, 300, 65535, 65536, 70000}) {
            MegolmRatchet jumped = start.copy();
            jumped.advanceTo(target);
            MegolmRatchet stepped = steppedTo(start, target);
            assertEquals(target, jumped.getIndex());
            assertArrayEquals(stepped.toBytes(), jumped.toBytes(), "index " + target);
        }
    }

    @Test
    public void advanceToFromNonZeroStart() {
        MegolmRatchet start = MegolmRatchet.fromBytes(seed(2), 0);
        start.advanceTo(250);

        MegolmRatchet jumped = start.copy();
        jumped.advanceTo(1030);
        assertArrayEquals(steppedTo(start, 1030).toBytes(), jumped.toBytes());
    }

    @Test
    public void advanceChangesTheKeys() {
        MegolmRatchet ratchet = MegolmRatchet.fromBytes(seed(3), 0);
        byte[] before = ratchet.toBytes();
        ratchet.advance();
        assertEquals(1, ratchet.getIndex());
        assertFalse(Arrays.equals(before, ratchet.toBytes()));
    }

    @Test
    public void indexIsUnsigned() {
        MegolmRatchet ratchet = MegolmRatchet.fromBytes(seed(4), 0xFFFFFFFEL);
        assertEquals(0xFFFFFFFEL, ratchet.getIndex());
    }

    @Test
    public void copyIsIndependent() {
        MegolmRatchet ratchet = MegolmRatchet.fromBytes(seed(5), 10);
        MegolmRatchet copy = ratchet.copy();
        ratchet.advance();
        assertEquals(10, copy.getIndex());
        assertArrayEquals(seed(5), copy.toBytes());
    }

    @Test
    public void rejectsSeedOfWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> MegolmRatchet.fromBytes(new byte[64], 0));
    }
}
