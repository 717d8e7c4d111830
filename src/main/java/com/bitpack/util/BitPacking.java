package com.bitpack.util;

import com.bitpack.Constants;
import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import lombok.experimental.UtilityClass;

/**
 * Stateless bit-level primitives: boolean flag packing, zigzag mapping and fixed-width
 * big-endian integers over raw byte arrays.
 */
@UtilityClass
public final class BitPacking {

    /**
     * Packs flags into an integer, {@code flags[i]} landing on bit {@code i} counted from the
     * least significant bit.
     *
     * @throws BitPackException with {@link ErrorType#SCHEMA_ERROR} for more than 64 flags
     */
    public static long packFlags(boolean... flags) throws BitPackException {
        if (flags.length > Constants.MAX_LONG_FLAGS) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR, "Cannot pack " + flags.length + " flags into 64 bits");
        }
        long result = 0;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) result |= 1L << i;
        }
        return result;
    }

    public static boolean[] unpackFlags(long bits, int count) throws BitPackException {
        if (count < 0 || count > Constants.MAX_LONG_FLAGS) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR, "Invalid flag count: " + count);
        }
        var result = new boolean[count];
        for (int i = 0; i < count; i++) {
            result[i] = (bits & (1L << i)) != 0;
        }
        return result;
    }

    public static int zigZagEncode32(int value) {
        return (value << 1) ^ (value >> 31);
    }

    public static int zigZagDecode32(int value) {
        return (value >>> 1) ^ -(value & 1);
    }

    public static long zigZagEncode64(long value) {
        return (value << 1) ^ (value >> 63);
    }

    public static long zigZagDecode64(long value) {
        return (value >>> 1) ^ -(value & 1L);
    }

    // Fixed-width writers, most significant byte first

    public static void writeShort(short value, byte[] dst, int offset) {
        dst[offset] = (byte) (value >>> 8);
        dst[offset + 1] = (byte) value;
    }

    public static void writeInt(int value, byte[] dst, int offset) {
        dst[offset] = (byte) (value >>> 24);
        dst[offset + 1] = (byte) (value >>> 16);
        dst[offset + 2] = (byte) (value >>> 8);
        dst[offset + 3] = (byte) value;
    }

    public static void writeLong(long value, byte[] dst, int offset) {
        for (int i = 7; i >= 0; i--) {
            dst[offset + i] = (byte) value;
            value >>>= 8;
        }
    }

    // Fixed-width readers

    public static short readShort(byte[] data, int offset, int limit) throws BitPackException {
        checkAvailable(offset, 2, limit, "int16");
        return (short) (((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF));
    }

    public static int readInt(byte[] data, int offset, int limit) throws BitPackException {
        checkAvailable(offset, 4, limit, "int32");
        int v = 0;
        for (int i = 0; i < 4; i++) {
            v = (v << 8) | (data[offset + i] & 0xFF);
        }
        return v;
    }

    public static long readLong(byte[] data, int offset, int limit) throws BitPackException {
        checkAvailable(offset, 8, limit, "int64");
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (data[offset + i] & 0xFFL);
        }
        return v;
    }

    public static short readShort(byte[] data, int offset) throws BitPackException {
        return readShort(data, offset, data.length);
    }

    public static int readInt(byte[] data, int offset) throws BitPackException {
        return readInt(data, offset, data.length);
    }

    public static long readLong(byte[] data, int offset) throws BitPackException {
        return readLong(data, offset, data.length);
    }

    private static void checkAvailable(int offset, int needed, int limit, String what) throws BitPackException {
        if (offset < 0 || limit - offset < needed) {
            throw new BitPackException(ErrorType.BUFFER_UNDERFLOW,
                "Not enough bytes for " + what + " at offset " + offset + ". Needed: " + needed
                    + ", available: " + Math.max(0, limit - offset));
        }
    }
}
