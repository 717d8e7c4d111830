package com.bitpack.util;

import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import org.junit.jupiter.api.Test;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for BitPackBuffer functionality and byte order compatibility with ByteBuffer.
 */
class BitPackBufferTest {

    @Test
    void testBasicPrimitiveWrites() throws BitPackException {
        BitPackBuffer buffer = BitPackBuffer.growable(64);

        buffer.putByte((byte) 0x42)
              .putShort((short) 0x1234)
              .putInt(0x12345678)
              .putLong(0x123456789ABCDEF0L)
              .putFloat(3.14f)
              .putDouble(2.718281828)
              .putChar('é');

        assertEquals(1 + 2 + 4 + 8 + 4 + 8 + 2, buffer.position());

        // ByteBuffer defaults to big-endian, the same order BitPackBuffer writes
        ByteBuffer byteBuffer = ByteBuffer.wrap(buffer.toByteArray());
        assertEquals((byte) 0x42, byteBuffer.get());
        assertEquals((short) 0x1234, byteBuffer.getShort());
        assertEquals(0x12345678, byteBuffer.getInt());
        assertEquals(0x123456789ABCDEF0L, byteBuffer.getLong());
        assertEquals(3.14f, byteBuffer.getFloat());
        assertEquals(2.718281828, byteBuffer.getDouble());
        assertEquals('é', byteBuffer.getChar());

        buffer.flip();
        assertEquals((byte) 0x42, buffer.get());
        assertEquals((short) 0x1234, buffer.getShort());
        assertEquals(0x12345678, buffer.getInt());
        assertEquals(0x123456789ABCDEF0L, buffer.getLong());
        assertEquals(3.14f, buffer.getFloat());
        assertEquals(2.718281828, buffer.getDouble());
        assertEquals('é', buffer.getChar());
        assertFalse(buffer.hasRemaining());
    }

    @Test
    void testGrowthPreservesContent() {
        BitPackBuffer buffer = BitPackBuffer.growable(2);

        for (int i = 0; i < 100; i++) {
            buffer.putInt(i);
        }

        assertEquals(400, buffer.position());
        assertTrue(buffer.capacity() >= 400);
        byte[] bytes = buffer.toByteArray();
        assertEquals(400, bytes.length);
        assertEquals(99, ByteBuffer.wrap(bytes, 396, 4).getInt());
    }

    @Test
    void testFixedBufferOverflow() {
        BitPackBuffer buffer = new BitPackBuffer(new byte[3]);

        assertFalse(buffer.isGrowable());
        assertTrue(buffer.canWrite(3));
        assertFalse(buffer.canWrite(4));
        assertThrows(BufferOverflowException.class, () -> buffer.putInt(1));
        assertTrue(BitPackBuffer.growable(1).canWrite(1000));
    }

    @Test
    void testReadPastLimit() {
        BitPackBuffer buffer = new BitPackBuffer(new byte[]{1, 2, 3});

        BitPackException e = assertThrows(BitPackException.class, buffer::getLong);
        assertEquals(ErrorType.BUFFER_UNDERFLOW, e.getErrorType());
        assertEquals(0, buffer.position(), "Failed read must not move the cursor");
    }

    @Test
    void testSliceOfArray() throws BitPackException {
        byte[] array = {9, 9, 0x00, 0x2a, 9};
        BitPackBuffer buffer = new BitPackBuffer(array, 2, 2);

        assertEquals(2, buffer.remaining());
        assertEquals(42, buffer.getShort());
        assertThrows(BitPackException.class, buffer::get);
    }

    @Test
    void testVarIntWrites() throws BitPackException {
        BitPackBuffer buffer = BitPackBuffer.growable(8);

        buffer.putVarInt(42);
        assertEquals(1, buffer.position());

        buffer.putVarInt(300);
        assertEquals(3, buffer.position());

        buffer.putVarLong(-1L);
        assertEquals(13, buffer.position());

        buffer.flip();
        assertEquals(42, buffer.getVarInt());
        assertEquals(300, buffer.getVarInt());
        assertEquals(-1L, buffer.getVarLong());
    }

    @Test
    void testStringWrites() throws BitPackException {
        BitPackBuffer buffer = BitPackBuffer.growable(8);

        buffer.putString("hi").putString("héllo 😀").putString("");

        buffer.flip();
        assertArrayEquals(new byte[]{0x02, 0x68, 0x69}, buffer.copyRange(0, 3));
        assertEquals("hi", buffer.getString());
        assertEquals("héllo 😀", buffer.getString());
        assertEquals("", buffer.getString());
    }

    @Test
    void testStringLengthBeyondRemaining() {
        BitPackBuffer buffer = new BitPackBuffer(new byte[]{0x05, 0x68, 0x69});

        BitPackException e = assertThrows(BitPackException.class, buffer::getString);
        assertEquals(ErrorType.INVALID_LENGTH, e.getErrorType());
        assertTrue(e.getErrorType().isMalformedInput());
    }

    @Test
    void testRawNaNBitsPreserved() throws BitPackException {
        int signalingFloatNaN = 0x7f800001;
        long signalingDoubleNaN = 0xfff0000000000001L;
        BitPackBuffer buffer = BitPackBuffer.growable(16);

        buffer.putFloat(Float.intBitsToFloat(signalingFloatNaN));
        buffer.putDouble(Double.longBitsToDouble(signalingDoubleNaN));

        buffer.flip();
        assertEquals(signalingFloatNaN, buffer.getInt());
        assertEquals(signalingDoubleNaN, buffer.getLong());
    }

    @Test
    void testPutWrittenAppendsOnlyWrittenBytes() {
        BitPackBuffer source = BitPackBuffer.growable(64);
        source.putByte((byte) 1).putByte((byte) 2);
        BitPackBuffer target = BitPackBuffer.growable(4);
        target.putByte((byte) 0);

        target.putWritten(source);

        assertArrayEquals(new byte[]{0, 1, 2}, target.toByteArray());
    }
}
