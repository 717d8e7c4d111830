package com.bitpack.schema;

import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;

import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Derives {@link StructureSchema}s from Java record classes.
 * <p>
 * Record components become fields in declaration order. {@code @VarInt} and {@code @VarUInt} on
 * {@code int} and {@code long} components select the VarInt mode. Component types the codec cannot
 * encode are still described (as {@link FieldKind#SEQUENCE}, {@link FieldKind#ENUM} and so on, or
 * as nullable for boxed and {@code Optional} types) so that encoding fails on that field.
 * Derived schemas are cached per class.
 */
public final class RecordSchemas {
    private static final Logger LOGGER = Logger.getLogger(RecordSchemas.class.getName());

    private static final Map<Class<?>, StructureSchema> CACHE = new ConcurrentHashMap<>();

    private static final Map<Class<?>, FieldKind> PRIMITIVE_KINDS = Map.of(
        boolean.class, FieldKind.BOOL,
        byte.class, FieldKind.BYTE,
        short.class, FieldKind.SHORT,
        int.class, FieldKind.INT32,
        long.class, FieldKind.INT64,
        float.class, FieldKind.FLOAT32,
        double.class, FieldKind.FLOAT64,
        char.class, FieldKind.CHAR,
        String.class, FieldKind.STRING);

    private static final Map<Class<?>, FieldKind> BOXED_KINDS = Map.of(
        Boolean.class, FieldKind.BOOL,
        Byte.class, FieldKind.BYTE,
        Short.class, FieldKind.SHORT,
        Integer.class, FieldKind.INT32,
        Long.class, FieldKind.INT64,
        Float.class, FieldKind.FLOAT32,
        Double.class, FieldKind.FLOAT64,
        Character.class, FieldKind.CHAR);

    private RecordSchemas() {}

    public static StructureSchema of(Class<? extends Record> recordType) throws BitPackException {
        var cached = CACHE.get(recordType);
        if (cached != null) {
            return cached;
        }
        var schema = derive(recordType);
        var previous = CACHE.putIfAbsent(recordType, schema);
        return previous != null ? previous : schema;
    }

    private static StructureSchema derive(Class<? extends Record> recordType) throws BitPackException {
        if (!recordType.isRecord()) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR, recordType.getName() + " is not a record class");
        }
        var builder = StructureSchema.builder(recordType.getSimpleName());
        for (RecordComponent component : recordType.getRecordComponents()) {
            var type = component.getType();
            var name = component.getName();
            var boxedKind = BOXED_KINDS.get(type);
            if (boxedKind != null) {
                builder.nullable(name, boxedKind);
            } else if (isOptional(type)) {
                builder.nullable(name, FieldKind.STRUCTURE);
            } else {
                builder.field(name, kindOf(type), Arrays.asList(component.getAnnotations()));
            }
        }
        var schema = builder.build();
        LOGGER.fine(() -> "Derived schema for " + recordType.getName() + ": " + schema.fieldCount()
            + " fields, " + schema.booleanCount() + " booleans " + schema.getFields());
        return schema;
    }

    static FieldKind kindOf(Class<?> type) {
        var kind = PRIMITIVE_KINDS.get(type);
        if (kind != null) return kind;
        if (type.isEnum()) return FieldKind.ENUM;
        if (type.isArray() || Collection.class.isAssignableFrom(type)) return FieldKind.SEQUENCE;
        if (Map.class.isAssignableFrom(type)) return FieldKind.MAP;
        if (type.isRecord()) return FieldKind.STRUCTURE;
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers()) || type.isSealed()) {
            return FieldKind.POLYMORPHIC;
        }
        // any other concrete class would need its own nested schema
        return FieldKind.STRUCTURE;
    }

    private static boolean isOptional(Class<?> type) {
        return type == Optional.class || type == OptionalInt.class
            || type == OptionalLong.class || type == OptionalDouble.class;
    }
}
