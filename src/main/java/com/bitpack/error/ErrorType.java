package com.bitpack.error;

import lombok.Getter;

/**
 * Types of errors that can occur while encoding or decoding bit-packed records.
 * <p>
 * {@link Category#USAGE} errors are programmer mistakes and never depend on the input bytes.
 * {@link Category#MALFORMED_INPUT} errors are raised only while decoding and mean the buffer
 * should be discarded.
 */
public enum ErrorType {
    NESTED_STRUCTURE(Category.USAGE),
    NOT_IN_STRUCTURE(Category.USAGE),
    INVALID_STATE(Category.USAGE),
    UNSUPPORTED_TYPE(Category.USAGE),
    NULL_NOT_SUPPORTED(Category.USAGE),
    TYPE_MISMATCH(Category.USAGE),
    SCHEMA_ERROR(Category.USAGE),
    FIELDS_NOT_CONSUMED(Category.USAGE),
    OUTPUT_OVERFLOW(Category.USAGE),

    MALFORMED_VARINT(Category.MALFORMED_INPUT),
    BUFFER_UNDERFLOW(Category.MALFORMED_INPUT),
    INVALID_LENGTH(Category.MALFORMED_INPUT);

    @Getter
    private final Category category;

    ErrorType(Category category) {
        this.category = category;
    }

    public boolean isUsageError() {
        return category == Category.USAGE;
    }

    public boolean isMalformedInput() {
        return category == Category.MALFORMED_INPUT;
    }

    public enum Category {
        USAGE,
        MALFORMED_INPUT
    }
}
