package com.bitpack.core;

import com.bitpack.Constants;
import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import com.bitpack.schema.FieldDescriptor;
import com.bitpack.schema.FieldKind;
import com.bitpack.schema.StructureSchema;
import com.bitpack.util.BitPackBuffer;
import com.bitpack.util.BitPacking;

import java.util.Objects;

/**
 * Decodes bit-packed records, mirroring {@link BitPackEncoder}.
 * <p>
 * The format carries no field tags, so fields must be read in exactly the order they were
 * written, against the same schema. Entering a structure consumes the flags VarInt and unpacks
 * all boolean fields at once; every other read advances the cursor by the bytes it consumed.
 * <p>
 * By default {@link #endStructure(DecodeSession)} does not check that every declared field was
 * read. Pass {@code verifyAllFieldsRead = true} (or set {@code bitpack.decoder.verify.fields})
 * to turn that check on.
 */
public final class BitPackDecoder {
    /** Returned by {@link #decodeElementIndex(DecodeSession)}: fields are never dispatched by index. */
    public static final int DECODE_DONE = -1;

    private final BitPackBuffer input;
    private final boolean verifyAllFieldsRead;
    private DecodeSession active;

    public BitPackDecoder(byte[] bytes) {
        this(new BitPackBuffer(bytes), Constants.VERIFY_FIELDS_DEFAULT);
    }

    public BitPackDecoder(byte[] bytes, boolean verifyAllFieldsRead) {
        this(new BitPackBuffer(bytes), verifyAllFieldsRead);
    }

    public BitPackDecoder(BitPackBuffer input, boolean verifyAllFieldsRead) {
        this.input = Objects.requireNonNull(input, "Input buffer cannot be null");
        this.verifyAllFieldsRead = verifyAllFieldsRead;
    }

    public boolean isInStructure() {
        return active != null;
    }

    public int position() {
        return input.position();
    }

    public int remaining() {
        return input.remaining();
    }

    /**
     * Opens a structure, reading and unpacking its flags.
     */
    public DecodeSession beginStructure(StructureSchema schema) throws BitPackException {
        Objects.requireNonNull(schema, "Schema cannot be null");
        if (active != null) {
            throw new BitPackException(ErrorType.NESTED_STRUCTURE,
                "Nested structures are not supported: cannot begin " + schema.getName()
                    + " while " + active.getSchema().getName() + " is open");
        }
        long flags = schema.hasLongFlags()
            ? input.getVarLong()
            : Integer.toUnsignedLong(input.getVarInt());
        var booleans = BitPacking.unpackFlags(flags, schema.booleanCount());
        active = new DecodeSession(schema, flags, booleans);
        return active;
    }

    /**
     * Closes the structure. With field verification on, fails with
     * {@link ErrorType#FIELDS_NOT_CONSUMED} if a non-boolean field was skipped; the decoder is
     * back to idle either way.
     */
    public void endStructure(DecodeSession session) throws BitPackException {
        checkSession(session);
        session.close();
        active = null;
        if (verifyAllFieldsRead) {
            int unread = session.firstUnconsumed();
            if (unread >= 0) {
                throw new BitPackException(ErrorType.FIELDS_NOT_CONSUMED,
                    "Field " + session.getSchema().getFields().get(unread) + " was never read");
            }
        }
    }

    /**
     * Fields are always consumed in declaration order.
     */
    public boolean decodeSequentially() {
        return true;
    }

    public int decodeElementIndex(DecodeSession session) throws BitPackException {
        checkSession(session);
        return DECODE_DONE;
    }

    // ========== STRUCTURE ELEMENTS ==========

    public boolean decodeBooleanElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.BOOL);
        return session.getBoolean(session.getSchema().booleanOrdinal(position));
    }

    public byte decodeByteElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.BYTE);
        return input.get();
    }

    public short decodeShortElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.SHORT);
        return input.getShort();
    }

    public int decodeIntElement(DecodeSession session, int position) throws BitPackException {
        var field = checkField(session, position, FieldKind.INT32);
        switch (field.getVarIntMode()) {
            case SIGNED:
                return input.getVarInt();
            case ZIGZAG:
                return BitPacking.zigZagDecode32(input.getVarInt());
            default:
                return input.getInt();
        }
    }

    public long decodeLongElement(DecodeSession session, int position) throws BitPackException {
        var field = checkField(session, position, FieldKind.INT64);
        switch (field.getVarIntMode()) {
            case SIGNED:
                return input.getVarLong();
            case ZIGZAG:
                return BitPacking.zigZagDecode64(input.getVarLong());
            default:
                return input.getLong();
        }
    }

    public float decodeFloatElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.FLOAT32);
        return input.getFloat();
    }

    public double decodeDoubleElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.FLOAT64);
        return input.getDouble();
    }

    public char decodeCharElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.CHAR);
        return input.getChar();
    }

    public String decodeStringElement(DecodeSession session, int position) throws BitPackException {
        checkField(session, position, FieldKind.STRING);
        return input.getString();
    }

    /**
     * Decodes a field as the boxed type of its declared kind.
     */
    public Object decodeElement(DecodeSession session, int position) throws BitPackException {
        checkSession(session);
        var field = session.getSchema().field(position);
        BitPackEncoder.checkSupported(field);

        switch (field.getKind()) {
            case BOOL:
                return decodeBooleanElement(session, position);
            case BYTE:
                return decodeByteElement(session, position);
            case SHORT:
                return decodeShortElement(session, position);
            case INT32:
                return decodeIntElement(session, position);
            case INT64:
                return decodeLongElement(session, position);
            case FLOAT32:
                return decodeFloatElement(session, position);
            case FLOAT64:
                return decodeDoubleElement(session, position);
            case CHAR:
                return decodeCharElement(session, position);
            case STRING:
                return decodeStringElement(session, position);
            default:
                throw new BitPackException(ErrorType.UNSUPPORTED_TYPE, "Cannot decode " + field);
        }
    }

    // ========== TOP-LEVEL SCALARS ==========

    public boolean decodeBoolean() throws BitPackException {
        checkTopLevel("boolean");
        return input.get() != 0;
    }

    public byte decodeByte() throws BitPackException {
        checkTopLevel("byte");
        return input.get();
    }

    public short decodeShort() throws BitPackException {
        checkTopLevel("short");
        return input.getShort();
    }

    public int decodeInt() throws BitPackException {
        checkTopLevel("int");
        return input.getInt();
    }

    public long decodeLong() throws BitPackException {
        checkTopLevel("long");
        return input.getLong();
    }

    public float decodeFloat() throws BitPackException {
        checkTopLevel("float");
        return input.getFloat();
    }

    public double decodeDouble() throws BitPackException {
        checkTopLevel("double");
        return input.getDouble();
    }

    public char decodeChar() throws BitPackException {
        checkTopLevel("char");
        return input.getChar();
    }

    public String decodeString() throws BitPackException {
        checkTopLevel("string");
        return input.getString();
    }

    // ========== CHECKS ==========

    private void checkSession(DecodeSession session) throws BitPackException {
        if (session == null || session != active) {
            throw new BitPackException(ErrorType.NOT_IN_STRUCTURE,
                session != null && session.isClosed()
                    ? "Structure " + session.getSchema().getName() + " has already ended"
                    : "No structure is open on this decoder for the given session");
        }
    }

    private void checkTopLevel(String what) throws BitPackException {
        if (active != null) {
            throw new BitPackException(ErrorType.INVALID_STATE,
                "Cannot decode a top-level " + what + " while structure " + active.getSchema().getName() + " is open");
        }
    }

    private FieldDescriptor checkField(DecodeSession session, int position, FieldKind expected) throws BitPackException {
        checkSession(session);
        var field = session.getSchema().field(position);
        BitPackEncoder.checkSupported(field);
        if (field.getKind() != expected) {
            throw new BitPackException(ErrorType.TYPE_MISMATCH,
                "Field " + field + " cannot be decoded as " + expected);
        }
        session.markConsumed(position);
        return field;
    }
}
