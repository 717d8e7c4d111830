package com.bitpack.util;

import com.bitpack.Constants;
import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Utility class for encoding and decoding variable-length integers (VarInt).
 * <p>
 * Values are written in 7-bit groups, least significant group first, with the high bit of every
 * byte except the last one set. Both widths treat the value as an unsigned bit pattern, so negative
 * numbers always take the maximum length (5 bytes for int, 10 for long).
 */
public final class VarInt {

    private static final int CONTINUATION_BIT = 0x80;
    private static final int SEGMENT_BITS = 0x7f;

    private VarInt() {} // utility class

    /**
     * Encode a 32-bit value as a VarInt.
     * @param value the value to encode (treated as unsigned)
     * @param buffer the buffer to write to
     */
    public static void encode(int value, BitPackBuffer buffer) {
        int val = value;
        while ((val & ~SEGMENT_BITS) != 0) {
            buffer.putByte((byte) ((val & SEGMENT_BITS) | CONTINUATION_BIT));
            val >>>= 7;
        }
        buffer.putByte((byte) val);
    }

    /**
     * Encode a 64-bit value as a VarInt.
     * @param value the value to encode (treated as unsigned)
     * @param buffer the buffer to write to
     */
    public static void encodeLong(long value, BitPackBuffer buffer) {
        long val = value;
        while ((val & ~SEGMENT_BITS) != 0) {
            buffer.putByte((byte) ((val & SEGMENT_BITS) | CONTINUATION_BIT));
            val >>>= 7;
        }
        buffer.putByte((byte) val);
    }

    /**
     * Decode a 32-bit VarInt starting at {@code offset}.
     * <p>
     * Groups beyond the 32nd bit wrap around silently, matching a plain int shift accumulator.
     *
     * @param data the bytes to decode from
     * @param offset index of the first VarInt byte
     * @param limit index one past the last readable byte
     * @return a DecodeResult containing the decoded value and number of bytes consumed
     * @throws BitPackException if the VarInt is longer than 5 bytes or runs past {@code limit}
     */
    public static DecodeResult decode(byte[] data, int offset, int limit) throws BitPackException {
        int result = 0;
        int shift = 0;
        int pos = offset;

        for (int bytesRead = 1; bytesRead <= Constants.MAX_VARINT_LEN; bytesRead++) {
            if (pos >= limit) {
                throw new BitPackException(ErrorType.BUFFER_UNDERFLOW,
                    "Unexpected end of data while reading VarInt at offset " + offset);
            }
            int b = data[pos++] & 0xFF;
            result |= (b & SEGMENT_BITS) << shift;
            if ((b & CONTINUATION_BIT) == 0) {
                return new DecodeResult(result, bytesRead);
            }
            shift += 7;
        }
        throw new BitPackException(ErrorType.MALFORMED_VARINT,
            "VarInt too long at offset " + offset + ", no terminating byte within "
                + Constants.MAX_VARINT_LEN + " bytes");
    }

    public static DecodeResult decode(byte[] data, int offset) throws BitPackException {
        return decode(data, offset, data.length);
    }

    /**
     * Decode a 64-bit VarInt starting at {@code offset}.
     * @throws BitPackException if the VarInt is longer than 10 bytes or runs past {@code limit}
     */
    public static LongDecodeResult decodeLong(byte[] data, int offset, int limit) throws BitPackException {
        long result = 0;
        int shift = 0;
        int pos = offset;

        for (int bytesRead = 1; bytesRead <= Constants.MAX_VARLONG_LEN; bytesRead++) {
            if (pos >= limit) {
                throw new BitPackException(ErrorType.BUFFER_UNDERFLOW,
                    "Unexpected end of data while reading VarLong at offset " + offset);
            }
            int b = data[pos++] & 0xFF;
            result |= (long) (b & SEGMENT_BITS) << shift;
            if ((b & CONTINUATION_BIT) == 0) {
                return new LongDecodeResult(result, bytesRead);
            }
            shift += 7;
        }
        throw new BitPackException(ErrorType.MALFORMED_VARINT,
            "VarLong too long at offset " + offset + ", no terminating byte within "
                + Constants.MAX_VARLONG_LEN + " bytes");
    }

    public static LongDecodeResult decodeLong(byte[] data, int offset) throws BitPackException {
        return decodeLong(data, offset, data.length);
    }

    /**
     * Calculate the number of bytes needed to encode the given value as a VarInt.
     * @param value the value to encode (treated as unsigned)
     * @return the number of bytes needed
     */
    public static int encodedLength(int value) {
        int val = value;
        int length = 1;
        while ((val & ~SEGMENT_BITS) != 0) {
            val >>>= 7;
            length++;
        }
        return length;
    }

    public static int encodedLength(long value) {
        long val = value;
        int length = 1;
        while ((val & ~SEGMENT_BITS) != 0) {
            val >>>= 7;
            length++;
        }
        return length;
    }

    /**
     * Result of a 32-bit VarInt decode operation.
     */
    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    public static class DecodeResult {
        private final int value;
        private final int bytesRead;
    }

    /**
     * Result of a 64-bit VarInt decode operation.
     */
    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    public static class LongDecodeResult {
        private final long value;
        private final int bytesRead;
    }
}
