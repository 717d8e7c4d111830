package com.bitpack.schema;

import com.bitpack.annotation.VarInt;
import com.bitpack.annotation.VarUInt;

import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.Collection;

/**
 * How an {@link FieldKind#INT32} or {@link FieldKind#INT64} field is laid out on the wire.
 */
public enum VarIntMode {
    /** Fixed 4 or 8 bytes, big-endian. */
    NONE,
    /** VarInt of the two's-complement bit pattern. */
    SIGNED,
    /** VarInt of the zigzag-mapped value. */
    ZIGZAG;

    public boolean isVarInt() {
        return this != NONE;
    }

    /**
     * Resolves the mode from field annotations. {@link VarUInt} wins over {@link VarInt}.
     */
    public static VarIntMode fromAnnotations(Collection<? extends Annotation> annotations) {
        boolean varInt = false;
        for (var annotation : annotations) {
            if (annotation instanceof VarUInt) {
                return ZIGZAG;
            }
            if (annotation instanceof VarInt) {
                varInt = true;
            }
        }
        return varInt ? SIGNED : NONE;
    }

    public static VarIntMode fromAnnotations(Annotation... annotations) {
        return fromAnnotations(Arrays.asList(annotations));
    }
}
