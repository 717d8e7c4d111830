package com.bitpack.util;

import com.bitpack.Constants;
import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import lombok.Getter;

import java.nio.BufferOverflowException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Byte buffer over a plain array with big-endian fixed-width accessors and VarInt support.
 * <p>
 * Writes grow the backing array when the buffer is growable. Reads are always bounds checked
 * against the limit and report {@link ErrorType#BUFFER_UNDERFLOW} instead of returning stale bytes.
 */
@SuppressWarnings("UnusedReturnValue")
public final class BitPackBuffer {

    private byte[] array;
    private final int arrayOffset;
    private int capacity;
    private int position;
    private int limit;

    @Getter
    private final boolean growable;

    /**
     * Create buffer wrapping a byte array.
     */
    public BitPackBuffer(byte[] array) {
        this(array, 0, array.length, false);
    }

    /**
     * Create buffer wrapping a byte array with optional growth capability.
     */
    public BitPackBuffer(byte[] array, boolean growable) {
        this(array, 0, array.length, growable);
    }

    /**
     * Create buffer wrapping a portion of byte array.
     */
    public BitPackBuffer(byte[] array, int offset, int length) {
        this(array, offset, length, false);
    }

    private BitPackBuffer(byte[] array, int offset, int length, boolean growable) {
        if (offset < 0 || length < 0 || offset + length > array.length) {
            throw new IllegalArgumentException("Invalid offset/length: " + offset + "/" + length);
        }
        this.array = array;
        this.arrayOffset = offset;
        this.capacity = length;
        this.position = 0;
        this.limit = length;
        this.growable = growable;
    }

    /**
     * Create growable buffer with initial capacity.
     */
    public static BitPackBuffer growable(int initialCapacity) {
        return new BitPackBuffer(new byte[Math.max(initialCapacity, 1)], true);
    }

    /**
     * Create growable buffer sized by {@code bitpack.buffer.initial.capacity}.
     */
    public static BitPackBuffer growable() {
        return growable(Constants.INITIAL_BUFFER_CAPACITY);
    }

    public int position() {
        return position;
    }

    public int limit() {
        return limit;
    }

    public int remaining() {
        return limit - position;
    }

    public boolean hasRemaining() {
        return position < limit;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Flip buffer for reading (set limit to position, position to 0).
     */
    public BitPackBuffer flip() {
        limit = position;
        position = 0;
        return this;
    }

    /**
     * Whether {@code bytes} more bytes can be written, growing the array if needed.
     */
    public boolean canWrite(int bytes) {
        return growable || remaining() >= bytes;
    }

    private void ensureCapacity(int additionalBytes) {
        int requiredCapacity = position + additionalBytes;
        if (requiredCapacity <= limit) return;
        if (!growable) {
            throw new BufferOverflowException();
        }

        // 1.5x growth, never below what the write needs
        int newCapacity = Math.max(requiredCapacity, (capacity * 3) / 2);
        byte[] newArray = new byte[arrayOffset + newCapacity];
        System.arraycopy(array, arrayOffset, newArray, arrayOffset, position);

        this.array = newArray;
        this.capacity = newCapacity;
        this.limit = newCapacity;
    }

    // ========== WRITES ==========

    public BitPackBuffer putByte(byte value) {
        ensureCapacity(1);
        array[arrayOffset + position] = value;
        position++;
        return this;
    }

    /**
     * Write int16, most significant byte first.
     */
    public BitPackBuffer putShort(short value) {
        ensureCapacity(2);
        BitPacking.writeShort(value, array, arrayOffset + position);
        position += 2;
        return this;
    }

    /**
     * Write a UTF-16 code unit as a big-endian int16.
     */
    public BitPackBuffer putChar(char value) {
        return putShort((short) value);
    }

    /**
     * Write int32, most significant byte first.
     */
    public BitPackBuffer putInt(int value) {
        ensureCapacity(4);
        BitPacking.writeInt(value, array, arrayOffset + position);
        position += 4;
        return this;
    }

    /**
     * Write int64, most significant byte first.
     */
    public BitPackBuffer putLong(long value) {
        ensureCapacity(8);
        BitPacking.writeLong(value, array, arrayOffset + position);
        position += 8;
        return this;
    }

    /**
     * Write float32 as its raw IEEE-754 bits, so NaN payloads survive.
     */
    public BitPackBuffer putFloat(float value) {
        return putInt(Float.floatToRawIntBits(value));
    }

    /**
     * Write float64 as its raw IEEE-754 bits, so NaN payloads survive.
     */
    public BitPackBuffer putDouble(double value) {
        return putLong(Double.doubleToRawLongBits(value));
    }

    public BitPackBuffer putBytes(byte[] src) {
        return putBytes(src, 0, src.length);
    }

    public BitPackBuffer putBytes(byte[] src, int srcOffset, int length) {
        if (srcOffset < 0 || length < 0 || srcOffset + length > src.length) {
            throw new IllegalArgumentException("Invalid src parameters");
        }
        ensureCapacity(length);
        System.arraycopy(src, srcOffset, array, arrayOffset + position, length);
        position += length;
        return this;
    }

    /**
     * Append everything written to {@code other} so far, i.e. its bytes before its position.
     */
    public BitPackBuffer putWritten(BitPackBuffer other) {
        return putBytes(other.array, other.arrayOffset, other.position);
    }

    public BitPackBuffer putVarInt(int value) {
        VarInt.encode(value, this);
        return this;
    }

    public BitPackBuffer putVarLong(long value) {
        VarInt.encodeLong(value, this);
        return this;
    }

    /**
     * Write UTF-8 string prefixed with its byte length as a VarInt.
     */
    public BitPackBuffer putString(String str) {
        byte[] utf8Bytes = str.getBytes(StandardCharsets.UTF_8);
        putVarInt(utf8Bytes.length);
        return putBytes(utf8Bytes);
    }

    // ========== READS ==========

    public byte get() throws BitPackException {
        if (position >= limit) {
            throw new BitPackException(ErrorType.BUFFER_UNDERFLOW,
                "Not enough bytes for int8 at offset " + position);
        }
        return array[arrayOffset + position++];
    }

    public short getShort() throws BitPackException {
        short value = BitPacking.readShort(array, arrayOffset + position, arrayOffset + limit);
        position += 2;
        return value;
    }

    public char getChar() throws BitPackException {
        return (char) getShort();
    }

    public int getInt() throws BitPackException {
        int value = BitPacking.readInt(array, arrayOffset + position, arrayOffset + limit);
        position += 4;
        return value;
    }

    public long getLong() throws BitPackException {
        long value = BitPacking.readLong(array, arrayOffset + position, arrayOffset + limit);
        position += 8;
        return value;
    }

    public float getFloat() throws BitPackException {
        return Float.intBitsToFloat(getInt());
    }

    public double getDouble() throws BitPackException {
        return Double.longBitsToDouble(getLong());
    }

    public int getVarInt() throws BitPackException {
        var result = VarInt.decode(array, arrayOffset + position, arrayOffset + limit);
        position += result.getBytesRead();
        return result.getValue();
    }

    public long getVarLong() throws BitPackException {
        var result = VarInt.decodeLong(array, arrayOffset + position, arrayOffset + limit);
        position += result.getBytesRead();
        return result.getValue();
    }

    /**
     * Read a VarInt length-prefixed UTF-8 string.
     */
    public String getString() throws BitPackException {
        int start = position;
        int length = getVarInt();
        if (length < 0 || length > remaining()) {
            throw new BitPackException(ErrorType.INVALID_LENGTH,
                "String length " + Integer.toUnsignedString(length) + " at offset " + start
                    + " exceeds remaining " + remaining() + " bytes");
        }
        var str = new String(array, arrayOffset + position, length, StandardCharsets.UTF_8);
        position += length;
        return str;
    }

    // ========== UTILITY METHODS ==========

    /**
     * Copy of the bytes written so far.
     */
    public byte[] toByteArray() {
        return Arrays.copyOfRange(array, arrayOffset, arrayOffset + position);
    }

    /**
     * Copy of the bytes between two buffer positions.
     */
    public byte[] copyRange(int from, int to) {
        if (from < 0 || from > to || to > capacity) {
            throw new IllegalArgumentException("Invalid range: " + from + ".." + to);
        }
        return Arrays.copyOfRange(array, arrayOffset + from, arrayOffset + to);
    }

    @Override
    public String toString() {
        return "BitPackBuffer{position=" + position + ", limit=" + limit + ", capacity=" + capacity + "}";
    }
}
