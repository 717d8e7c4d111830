package com.bitpack.schema;

import lombok.Getter;

/**
 * The kind of value a record field holds, as reported by whatever describes the record type.
 * <p>
 * Only scalar kinds can be encoded. The remaining kinds exist so a schema can faithfully describe
 * a field the codec refuses, and the refusal happens when that field is encoded or decoded.
 */
public enum FieldKind {
    BOOL(true),
    BYTE(true),
    SHORT(true),
    INT32(true),
    INT64(true),
    FLOAT32(true),
    FLOAT64(true),
    CHAR(true),
    STRING(true),
    ENUM(false),
    SEQUENCE(false),
    MAP(false),
    STRUCTURE(false),
    POLYMORPHIC(false);

    @Getter
    private final boolean scalar;

    FieldKind(boolean scalar) {
        this.scalar = scalar;
    }

    public boolean supportsVarInt() {
        return this == INT32 || this == INT64;
    }
}
