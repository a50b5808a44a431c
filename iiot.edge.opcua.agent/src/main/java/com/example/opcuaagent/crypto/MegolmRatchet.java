package com.example.opcuaagent.crypto;

import java.util.Arrays;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * The Megolm ratchet: four 32 byte parts R0..R3 and a 32 bit counter.
 * <p>
 * Part {@code Ri} is re-derived every {@code 2^(8*(3-i))} steps from its own previous value, and
 * re-seeds the parts below it. Advancing is one way: a ratchet at index {@code n} can derive the
 * keys of any later index but none of an earlier one.
 * <p>
 * Not thread safe; callers hold the device lock of the session store.
 */
public final class MegolmRatchet {

    public static final int PART_LENGTH = 32;
    public static final int PARTS = 4;
    public static final int LENGTH = PART_LENGTH * PARTS;

    private final byte[][] data = new byte[PARTS][PART_LENGTH];

    /** Unsigned 32 bit index of the next message. */
    private int counter;

    private MegolmRatchet() {
    }

    /**
     * @param randomData 128 random bytes seeding all four parts
     * @param counter    unsigned 32 bit start index
     */
    public static MegolmRatchet fromBytes(byte[] randomData, long counter) {
        if (randomData.length != LENGTH) {
            throw new IllegalArgumentException("Ratchet data must be " + LENGTH + " bytes, got " + randomData.length);
        }
        MegolmRatchet ratchet = new MegolmRatchet();
        for (int i = 0; i < PARTS; i++) {
            System.arraycopy(randomData, i * PART_LENGTH, ratchet.data[i], 0, PART_LENGTH);
        }
        ratchet.counter = (int) counter;
        return ratchet;
    }

    public MegolmRatchet copy() {
        MegolmRatchet copy = new MegolmRatchet();
        for (int i = 0; i < PARTS; i++) {
            System.arraycopy(data[i], 0, copy.data[i], 0, PART_LENGTH);
        }
        copy.counter = counter;
        return copy;
    }

    /**
     * @return the index of the next message, in the range 0 to 2^32-1
     */
    public long getIndex() {
        return Integer.toUnsignedLong(counter);
    }

    public byte[] toBytes() {
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < PARTS; i++) {
            System.arraycopy(data[i], 0, out, i * PART_LENGTH, PART_LENGTH);
        }
        return out;
    }

    /**
     * Advances by one step.
     */
    public void advance() {
        int mask = 0x00FFFFFF;
        int h = 0;

        counter++;

        // find the most significant part whose counter byte changed
        while (h < PARTS) {
            if ((counter & mask) == 0) {
                break;
            }
            h++;
            mask >>>= 8;
        }

        for (int i = PARTS - 1; i >= h; i--) {
            rehashPart(h, i);
        }
    }

    /**
     * Advances to the given index in at most 4 * 256 hash operations.
     *
     * @param index unsigned 32 bit target index, must not be lower than {@link #getIndex()}
     */
    public void advanceTo(long index) {
        int target = (int) index;

        for (int j = 0; j < PARTS; j++) {
            int shift = (PARTS - 1 - j) * 8;
            int mask = -1 << shift;

            int steps = ((target >>> shift) - (counter >>> shift)) & 0xFF;
            if (steps == 0) {
                if (Integer.compareUnsigned(target, counter) < 0) {
                    steps = 0x100;
                } else {
                    continue;
                }
            }

            // for all but the last step, only Rj needs rehashing
            while (steps > 1) {
                rehashPart(j, j);
                steps--;
            }
            for (int k = PARTS - 1; k >= j; k--) {
                rehashPart(j, k);
            }
            counter = target & mask;
        }
    }

    /**
     * Derives the message keys of the current index. Does not advance.
     */
    public MessageKeys deriveKeys() {
        byte[] ikm = toBytes();
        try {
            return MessageKeys.derive(ikm);
        } finally {
            Arrays.fill(ikm, (byte) 0);
        }
    }

    /**
     * R(to) = HMAC-SHA256(key = R(from), data = [to])
     */
    private void rehashPart(int from, int to) {
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(data[from]));
        hmac.update((byte) to);
        byte[] out = new byte[PART_LENGTH];
        hmac.doFinal(out, 0);
        data[to] = out;
    }
}
