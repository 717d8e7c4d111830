package com.bitpack.schema;

import lombok.Value;

/**
 * One field of a record type, in declaration order.
 */
@Value
public class FieldDescriptor {
    int position;
    String name;
    FieldKind kind;
    VarIntMode varIntMode;
    boolean nullable;

    public static FieldDescriptor of(int position, String name, FieldKind kind) {
        return new FieldDescriptor(position, name, kind, VarIntMode.NONE, false);
    }

    public static FieldDescriptor of(int position, String name, FieldKind kind, VarIntMode varIntMode) {
        return new FieldDescriptor(position, name, kind, varIntMode, false);
    }

    public boolean isBoolean() {
        return kind == FieldKind.BOOL;
    }

    public boolean isVarInt() {
        return varIntMode.isVarInt();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append('#').append(position).append(' ').append(name).append(':').append(kind);
        if (varIntMode != VarIntMode.NONE) sb.append('[').append(varIntMode).append(']');
        if (nullable) sb.append('?');
        return sb.toString();
    }
}
