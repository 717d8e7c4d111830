package com.bitpack.core;

import com.bitpack.schema.StructureSchema;
import lombok.Getter;

/**
 * State of one structure being decoded. The boolean fields are unpacked when the structure is
 * entered, so reading them is a lookup.
 */
public final class DecodeSession {
    @Getter
    private final StructureSchema schema;
    @Getter
    private final long flags;
    private final boolean[] booleanValues;
    private final boolean[] consumed;
    @Getter
    private boolean closed;

    DecodeSession(StructureSchema schema, long flags, boolean[] booleanValues) {
        this.schema = schema;
        this.flags = flags;
        this.booleanValues = booleanValues;
        this.consumed = new boolean[schema.fieldCount()];
    }

    boolean getBoolean(int ordinal) {
        return booleanValues[ordinal];
    }

    void markConsumed(int position) {
        consumed[position] = true;
    }

    /**
     * First non-boolean position never read, or -1.
     */
    int firstUnconsumed() {
        for (int i = 0; i < consumed.length; i++) {
            if (!consumed[i] && schema.booleanOrdinal(i) < 0) return i;
        }
        return -1;
    }

    void close() {
        closed = true;
    }
}
