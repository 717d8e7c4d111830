package com.bitpack.core;

import com.bitpack.error.BitPackException;
import com.bitpack.schema.StructureSchema;
import com.bitpack.util.BitPackBuffer;
import com.bitpack.util.BitPacking;
import lombok.Getter;

/**
 * State of one structure being encoded: the boolean accumulator and the bytes of every
 * non-boolean field written so far. Only the {@link BitPackEncoder} that opened it may use it,
 * and only until {@link BitPackEncoder#endStructure(EncodeSession)}.
 */
public final class EncodeSession {
    @Getter
    private final StructureSchema schema;
    private final boolean[] booleanValues;
    private final BitPackBuffer data;
    @Getter
    private boolean closed;

    EncodeSession(StructureSchema schema) {
        this.schema = schema;
        this.booleanValues = new boolean[schema.booleanCount()];
        this.data = BitPackBuffer.growable();
    }

    void setBoolean(int ordinal, boolean value) {
        booleanValues[ordinal] = value;
    }

    long packedFlags() throws BitPackException {
        return BitPacking.packFlags(booleanValues);
    }

    BitPackBuffer data() {
        return data;
    }

    void close() {
        closed = true;
    }

    /**
     * Number of non-boolean field bytes buffered and not yet emitted.
     */
    public int pendingBytes() {
        return data.position();
    }
}
