package com.bitpack.core;

import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import com.bitpack.schema.FieldDescriptor;
import com.bitpack.schema.FieldKind;
import com.bitpack.schema.StructureSchema;
import com.bitpack.util.BitPackBuffer;
import com.bitpack.util.BitPacking;
import com.bitpack.util.VarInt;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Encodes flat records into the bit-packed wire format.
 * <p>
 * A structure is written as {@code varint(flags) || non-boolean fields in declaration order}.
 * Boolean fields only set bits in the session's accumulator; every other field is serialized
 * into the session's data buffer as soon as it is encoded. {@link #endStructure(EncodeSession)}
 * writes the flags followed by the buffered field bytes to this encoder's output.
 * <p>
 * Values encoded with no structure open (the {@code encodeX} methods without a session) are
 * written bare to the output. An encoder holds at most one open structure and is not thread-safe.
 * <p>
 * Usage:
 * <pre>
 *   var encoder = new BitPackEncoder();
 *   var session = encoder.beginStructure(schema);
 *   encoder.encodeIntElement(session, 0, 123);
 *   encoder.encodeBooleanElement(session, 1, true);
 *   byte[] bytes = encoder.endStructure(session);
 * </pre>
 */
public final class BitPackEncoder {
    private final BitPackBuffer output;
    private EncodeSession active;

    public BitPackEncoder() {
        this(BitPackBuffer.growable());
    }

    public BitPackEncoder(BitPackBuffer output) {
        this.output = Objects.requireNonNull(output, "Output buffer cannot be null");
    }

    public boolean isInStructure() {
        return active != null;
    }

    /**
     * Opens a structure. Fails with {@link ErrorType#NESTED_STRUCTURE} while another structure is
     * open on this encoder, in which case the open one is left untouched.
     */
    public EncodeSession beginStructure(StructureSchema schema) throws BitPackException {
        Objects.requireNonNull(schema, "Schema cannot be null");
        if (active != null) {
            throw new BitPackException(ErrorType.NESTED_STRUCTURE,
                "Nested structures are not supported: cannot begin " + schema.getName()
                    + " while " + active.getSchema().getName() + " is open");
        }
        active = new EncodeSession(schema);
        return active;
    }

    /**
     * Closes the structure and writes it to the output.
     * <p>
     * If a fixed-size output cannot hold the whole structure, nothing is written, the session is
     * discarded and {@link ErrorType#OUTPUT_OVERFLOW} is thrown; the encoder is idle afterwards.
     *
     * @return the bytes of this structure
     */
    public byte[] endStructure(EncodeSession session) throws BitPackException {
        checkSession(session);
        var schema = session.getSchema();
        long flags = session.packedFlags();
        int flagsLength = schema.hasLongFlags() ? VarInt.encodedLength(flags) : VarInt.encodedLength((int) flags);

        session.close();
        active = null;
        checkRoom(flagsLength + session.pendingBytes(), "structure " + schema.getName());

        int start = output.position();
        if (schema.hasLongFlags()) {
            output.putVarLong(flags);
        } else {
            output.putVarInt((int) flags);
        }
        output.putWritten(session.data());
        return output.copyRange(start, output.position());
    }

    // ========== STRUCTURE ELEMENTS ==========

    public void encodeBooleanElement(EncodeSession session, int position, boolean value) throws BitPackException {
        checkField(session, position, FieldKind.BOOL);
        session.setBoolean(session.getSchema().booleanOrdinal(position), value);
    }

    public void encodeByteElement(EncodeSession session, int position, byte value) throws BitPackException {
        checkField(session, position, FieldKind.BYTE);
        session.data().putByte(value);
    }

    public void encodeShortElement(EncodeSession session, int position, short value) throws BitPackException {
        checkField(session, position, FieldKind.SHORT);
        session.data().putShort(value);
    }

    public void encodeIntElement(EncodeSession session, int position, int value) throws BitPackException {
        var field = checkField(session, position, FieldKind.INT32);
        var data = session.data();
        switch (field.getVarIntMode()) {
            case SIGNED:
                data.putVarInt(value);
                break;
            case ZIGZAG:
                data.putVarInt(BitPacking.zigZagEncode32(value));
                break;
            default:
                data.putInt(value);
        }
    }

    public void encodeLongElement(EncodeSession session, int position, long value) throws BitPackException {
        var field = checkField(session, position, FieldKind.INT64);
        var data = session.data();
        switch (field.getVarIntMode()) {
            case SIGNED:
                data.putVarLong(value);
                break;
            case ZIGZAG:
                data.putVarLong(BitPacking.zigZagEncode64(value));
                break;
            default:
                data.putLong(value);
        }
    }

    public void encodeFloatElement(EncodeSession session, int position, float value) throws BitPackException {
        checkField(session, position, FieldKind.FLOAT32);
        session.data().putFloat(value);
    }

    public void encodeDoubleElement(EncodeSession session, int position, double value) throws BitPackException {
        checkField(session, position, FieldKind.FLOAT64);
        session.data().putDouble(value);
    }

    public void encodeCharElement(EncodeSession session, int position, char value) throws BitPackException {
        checkField(session, position, FieldKind.CHAR);
        session.data().putChar(value);
    }

    public void encodeStringElement(EncodeSession session, int position, String value) throws BitPackException {
        var field = checkField(session, position, FieldKind.STRING);
        checkNotNull(field, value);
        session.data().putString(value);
    }

    /**
     * Encodes a boxed value, dispatching on the field's declared kind.
     */
    public void encodeElement(EncodeSession session, int position, Object value) throws BitPackException {
        checkSession(session);
        var field = session.getSchema().field(position);
        checkSupported(field);
        checkNotNull(field, value);

        switch (field.getKind()) {
            case BOOL:
                encodeBooleanElement(session, position, cast(field, value, Boolean.class));
                break;
            case BYTE:
                encodeByteElement(session, position, cast(field, value, Byte.class));
                break;
            case SHORT:
                encodeShortElement(session, position, cast(field, value, Short.class));
                break;
            case INT32:
                encodeIntElement(session, position, cast(field, value, Integer.class));
                break;
            case INT64:
                encodeLongElement(session, position, cast(field, value, Long.class));
                break;
            case FLOAT32:
                encodeFloatElement(session, position, cast(field, value, Float.class));
                break;
            case FLOAT64:
                encodeDoubleElement(session, position, cast(field, value, Double.class));
                break;
            case CHAR:
                encodeCharElement(session, position, cast(field, value, Character.class));
                break;
            case STRING:
                encodeStringElement(session, position, cast(field, value, String.class));
                break;
            default:
                throw new BitPackException(ErrorType.UNSUPPORTED_TYPE, "Cannot encode " + field);
        }
    }

    // ========== TOP-LEVEL SCALARS ==========

    public void encodeBoolean(boolean value) throws BitPackException {
        checkTopLevel("boolean");
        checkRoom(1, "boolean");
        output.putByte((byte) (value ? 1 : 0));
    }

    public void encodeByte(byte value) throws BitPackException {
        checkTopLevel("byte");
        checkRoom(1, "byte");
        output.putByte(value);
    }

    public void encodeShort(short value) throws BitPackException {
        checkTopLevel("short");
        checkRoom(2, "short");
        output.putShort(value);
    }

    public void encodeInt(int value) throws BitPackException {
        checkTopLevel("int");
        checkRoom(4, "int");
        output.putInt(value);
    }

    public void encodeLong(long value) throws BitPackException {
        checkTopLevel("long");
        checkRoom(8, "long");
        output.putLong(value);
    }

    public void encodeFloat(float value) throws BitPackException {
        checkTopLevel("float");
        checkRoom(4, "float");
        output.putFloat(value);
    }

    public void encodeDouble(double value) throws BitPackException {
        checkTopLevel("double");
        checkRoom(8, "double");
        output.putDouble(value);
    }

    public void encodeChar(char value) throws BitPackException {
        checkTopLevel("char");
        checkRoom(2, "char");
        output.putChar(value);
    }

    public void encodeString(String value) throws BitPackException {
        checkTopLevel("string");
        if (value == null) {
            throw new BitPackException(ErrorType.NULL_NOT_SUPPORTED, "Null is not supported in this format");
        }
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        checkRoom(VarInt.encodedLength(utf8.length) + utf8.length, "string");
        output.putVarInt(utf8.length);
        output.putBytes(utf8);
    }

    /**
     * Copy of everything written to the output so far.
     */
    public byte[] toByteArray() {
        return output.toByteArray();
    }

    public int size() {
        return output.position();
    }

    // ========== CHECKS ==========

    private void checkSession(EncodeSession session) throws BitPackException {
        if (session == null || session != active) {
            throw new BitPackException(ErrorType.NOT_IN_STRUCTURE,
                session != null && session.isClosed()
                    ? "Structure " + session.getSchema().getName() + " has already ended"
                    : "No structure is open on this encoder for the given session");
        }
    }

    private void checkTopLevel(String what) throws BitPackException {
        if (active != null) {
            throw new BitPackException(ErrorType.INVALID_STATE,
                "Cannot encode a top-level " + what + " while structure " + active.getSchema().getName() + " is open");
        }
    }

    private void checkRoom(int bytes, String what) throws BitPackException {
        if (!output.canWrite(bytes)) {
            throw new BitPackException(ErrorType.OUTPUT_OVERFLOW,
                "Output has " + output.remaining() + " bytes left, " + what + " needs " + bytes);
        }
    }

    private FieldDescriptor checkField(EncodeSession session, int position, FieldKind expected) throws BitPackException {
        checkSession(session);
        var field = session.getSchema().field(position);
        checkSupported(field);
        if (field.getKind() != expected) {
            throw new BitPackException(ErrorType.TYPE_MISMATCH,
                "Field " + field + " cannot be encoded as " + expected);
        }
        return field;
    }

    static void checkSupported(FieldDescriptor field) throws BitPackException {
        if (!field.getKind().isScalar()) {
            throw new BitPackException(ErrorType.UNSUPPORTED_TYPE,
                "Nested structures, collections, enums and polymorphic values are not supported: " + field);
        }
        if (field.isNullable()) {
            throw new BitPackException(ErrorType.UNSUPPORTED_TYPE,
                "Nullable fields are not supported: " + field);
        }
    }

    private static void checkNotNull(FieldDescriptor field, Object value) throws BitPackException {
        if (value == null) {
            throw new BitPackException(ErrorType.NULL_NOT_SUPPORTED,
                "Null values are not supported: " + field);
        }
    }

    private static <T> T cast(FieldDescriptor field, Object value, Class<T> type) throws BitPackException {
        if (!type.isInstance(value)) {
            throw new BitPackException(ErrorType.TYPE_MISMATCH,
                "Field " + field + " expects " + type.getSimpleName() + " but got " + value.getClass().getName());
        }
        return type.cast(value);
    }
}
