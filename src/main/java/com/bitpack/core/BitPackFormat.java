package com.bitpack.core;

import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import com.bitpack.schema.RecordSchemas;
import com.bitpack.schema.StructureSchema;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One-call encoding and decoding on top of {@link BitPackEncoder} and {@link BitPackDecoder}.
 * <p>
 * Every call uses a fresh engine, so calls share no state and may run concurrently.
 * <p>
 * Usage:
 * <pre>
 *   record Payload(@VarInt int id, @VarUInt int delta, boolean flag1, boolean flag2) {}
 *
 *   byte[] bytes = BitPackFormat.encodeRecord(new Payload(123, -2, true, false));
 *   Payload payload = BitPackFormat.decodeRecord(Payload.class, bytes);
 * </pre>
 */
public final class BitPackFormat {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        short.class, Short.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class,
        char.class, Character.class);

    private BitPackFormat() {}

    /**
     * Encodes one value per schema field, in declaration order.
     */
    public static byte[] encode(StructureSchema schema, List<?> values) throws BitPackException {
        if (values.size() != schema.fieldCount()) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                schema.getName() + " has " + schema.fieldCount() + " fields but " + values.size() + " values were given");
        }
        var encoder = new BitPackEncoder();
        var session = encoder.beginStructure(schema);
        for (int position = 0; position < values.size(); position++) {
            encoder.encodeElement(session, position, values.get(position));
        }
        return encoder.endStructure(session);
    }

    /**
     * Decodes one boxed value per schema field, in declaration order.
     */
    public static List<Object> decode(StructureSchema schema, byte[] bytes) throws BitPackException {
        var decoder = new BitPackDecoder(bytes);
        var session = decoder.beginStructure(schema);
        var values = new ArrayList<>(schema.fieldCount());
        for (int position = 0; position < schema.fieldCount(); position++) {
            values.add(decoder.decodeElement(session, position));
        }
        decoder.endStructure(session);
        return values;
    }

    public static byte[] encodeRecord(Record record) throws BitPackException {
        var type = record.getClass();
        var schema = RecordSchemas.of(type);
        var components = type.getRecordComponents();
        var values = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            values.add(readComponent(record, component));
        }
        return encode(schema, values);
    }

    public static <T extends Record> T decodeRecord(Class<T> type, byte[] bytes) throws BitPackException {
        var schema = RecordSchemas.of(type);
        var values = decode(schema, bytes);
        var components = type.getRecordComponents();
        var parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor.newInstance(values.toArray());
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                "Cannot access canonical constructor of " + type.getName(), e);
        } catch (InvocationTargetException e) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                "Canonical constructor of " + type.getName() + " rejected decoded values", e.getCause());
        }
    }

    /**
     * Encodes a single boxed scalar without any structure wrapper. Records are encoded as
     * structures.
     */
    public static byte[] encodeScalar(Object value) throws BitPackException {
        if (value instanceof Record) {
            return encodeRecord((Record) value);
        }
        var encoder = new BitPackEncoder();
        if (value == null) {
            throw new BitPackException(ErrorType.NULL_NOT_SUPPORTED, "Null is not supported in this format");
        } else if (value instanceof Boolean) {
            encoder.encodeBoolean((Boolean) value);
        } else if (value instanceof Byte) {
            encoder.encodeByte((Byte) value);
        } else if (value instanceof Short) {
            encoder.encodeShort((Short) value);
        } else if (value instanceof Integer) {
            encoder.encodeInt((Integer) value);
        } else if (value instanceof Long) {
            encoder.encodeLong((Long) value);
        } else if (value instanceof Float) {
            encoder.encodeFloat((Float) value);
        } else if (value instanceof Double) {
            encoder.encodeDouble((Double) value);
        } else if (value instanceof Character) {
            encoder.encodeChar((Character) value);
        } else if (value instanceof String) {
            encoder.encodeString((String) value);
        } else {
            throw new BitPackException(ErrorType.UNSUPPORTED_TYPE,
                "Unsupported top-level type: " + value.getClass().getName());
        }
        return encoder.toByteArray();
    }

    /**
     * Decodes a single scalar written by {@link #encodeScalar(Object)}. Primitive classes are
     * accepted and yield their wrapper.
     */
    @SuppressWarnings("unchecked")
    public static <T> T decodeScalar(Class<T> type, byte[] bytes) throws BitPackException {
        Class<?> boxed = WRAPPERS.getOrDefault(type, type);
        var decoder = new BitPackDecoder(bytes);
        Object value;
        if (boxed == Boolean.class) {
            value = decoder.decodeBoolean();
        } else if (boxed == Byte.class) {
            value = decoder.decodeByte();
        } else if (boxed == Short.class) {
            value = decoder.decodeShort();
        } else if (boxed == Integer.class) {
            value = decoder.decodeInt();
        } else if (boxed == Long.class) {
            value = decoder.decodeLong();
        } else if (boxed == Float.class) {
            value = decoder.decodeFloat();
        } else if (boxed == Double.class) {
            value = decoder.decodeDouble();
        } else if (boxed == Character.class) {
            value = decoder.decodeChar();
        } else if (boxed == String.class) {
            value = decoder.decodeString();
        } else if (type.isRecord()) {
            value = decodeRecord(type.asSubclass(Record.class), bytes);
        } else {
            throw new BitPackException(ErrorType.UNSUPPORTED_TYPE, "Unsupported top-level type: " + type.getName());
        }
        return (T) value;
    }

    private static Object readComponent(Record record, RecordComponent component) throws BitPackException {
        var accessor = component.getAccessor();
        try {
            accessor.setAccessible(true);
            return accessor.invoke(record);
        } catch (IllegalAccessException e) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                "Cannot read component " + component.getName() + " of " + record.getClass().getName(), e);
        } catch (InvocationTargetException e) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                "Accessor of " + component.getName() + " failed on " + record.getClass().getName(), e.getCause());
        }
    }
}
