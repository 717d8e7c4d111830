package com.bitpack.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Encodes an {@code int} or {@code long} field as a VarInt instead of 4 or 8 fixed bytes.
 * <p>
 * Negative values take the maximum VarInt length; use {@link VarUInt} for fields that are
 * often small and negative.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD, ElementType.METHOD})
public @interface VarInt {
}
