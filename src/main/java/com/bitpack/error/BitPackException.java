package com.bitpack.error;

import lombok.Getter;

/**
 * Exception thrown by bit-packed encoding and decoding operations.
 */
@Getter
public class BitPackException extends Exception {
    private final ErrorType errorType;

    public BitPackException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public BitPackException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("BitPackException{type=%s, message='%s'}", errorType, getMessage());
    }
}
