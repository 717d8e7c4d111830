package com.bitpack;

public final class Constants {
    public static final int MAX_VARINT_LEN = 5;
    public static final int MAX_VARLONG_LEN = 10;
    public static final int MAX_INT_FLAGS = 32;
    public static final int MAX_LONG_FLAGS = 64;

    public static final String INITIAL_CAPACITY_PROPERTY = "bitpack.buffer.initial.capacity";
    public static final String VERIFY_FIELDS_PROPERTY = "bitpack.decoder.verify.fields";

    public static final int INITIAL_BUFFER_CAPACITY = Integer.getInteger(INITIAL_CAPACITY_PROPERTY, 64);
    public static final boolean VERIFY_FIELDS_DEFAULT = Boolean.parseBoolean(
        System.getProperty(VERIFY_FIELDS_PROPERTY, "false"));

    private Constants() {}
}
