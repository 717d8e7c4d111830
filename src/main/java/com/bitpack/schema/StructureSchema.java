package com.bitpack.schema;

import com.bitpack.Constants;
import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Ordered, immutable description of a flat record type.
 * <p>
 * Besides the descriptors themselves the schema keeps the positions of its boolean fields in
 * declaration order. The i-th entry of that list owns bit i of the record's flags integer, so
 * declaration order (not absolute position) decides bit significance.
 * <p>
 * Usage:
 * <pre>
 *   var schema = StructureSchema.builder("Payload")
 *       .int32("id", VarIntMode.SIGNED)
 *       .int32("delta", VarIntMode.ZIGZAG)
 *       .bool("flag1")
 *       .string("label")
 *       .build();
 * </pre>
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class StructureSchema {
    @Getter
    @EqualsAndHashCode.Include
    private final String name;

    @Getter
    @EqualsAndHashCode.Include
    private final List<FieldDescriptor> fields;

    @Getter
    private final IntList booleanPositions;

    // position -> index into booleanPositions, -1 for non-boolean fields
    private final int[] booleanOrdinals;

    private StructureSchema(String name, List<FieldDescriptor> fields) throws BitPackException {
        for (int i = 0; i < fields.size(); i++) {
            var field = fields.get(i);
            if (field == null || field.getName() == null || field.getKind() == null || field.getVarIntMode() == null) {
                throw new BitPackException(ErrorType.SCHEMA_ERROR,
                    "Field at index " + i + " of " + name + " is incomplete: " + field);
            }
        }
        this.name = name;
        this.fields = List.copyOf(fields);
        this.booleanOrdinals = new int[fields.size()];

        var booleans = new IntArrayList();
        for (int i = 0; i < this.fields.size(); i++) {
            var field = this.fields.get(i);
            if (field.getPosition() != i) {
                throw new BitPackException(ErrorType.SCHEMA_ERROR,
                    "Field positions of " + name + " must be contiguous from 0, found " + field.getPosition() + " at index " + i);
            }
            if (field.getVarIntMode() != VarIntMode.NONE && !field.getKind().supportsVarInt()) {
                throw new BitPackException(ErrorType.SCHEMA_ERROR,
                    "VarInt mode " + field.getVarIntMode() + " is not valid for " + field);
            }
            if (field.isBoolean()) {
                booleanOrdinals[i] = booleans.size();
                booleans.add(i);
            } else {
                booleanOrdinals[i] = -1;
            }
        }
        if (booleans.size() > Constants.MAX_LONG_FLAGS) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                name + " declares " + booleans.size() + " boolean fields, at most " + Constants.MAX_LONG_FLAGS + " are supported");
        }
        this.booleanPositions = IntLists.unmodifiable(booleans);
    }

    public static StructureSchema of(String name, List<FieldDescriptor> fields) throws BitPackException {
        return new StructureSchema(name, fields);
    }

    public static StructureSchema of(String name, FieldDescriptor... fields) throws BitPackException {
        return new StructureSchema(name, Arrays.asList(fields));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public int fieldCount() {
        return fields.size();
    }

    public int booleanCount() {
        return booleanPositions.size();
    }

    /**
     * Flags are carried as a 64-bit VarInt once the record has more booleans than fit in an int.
     */
    public boolean hasLongFlags() {
        return booleanPositions.size() > Constants.MAX_INT_FLAGS;
    }

    public FieldDescriptor field(int position) throws BitPackException {
        if (position < 0 || position >= fields.size()) {
            throw new BitPackException(ErrorType.SCHEMA_ERROR,
                "Position " + position + " is outside " + name + " (" + fields.size() + " fields)");
        }
        return fields.get(position);
    }

    /**
     * Index of the field among the boolean fields, or -1 if the field is not boolean.
     */
    public int booleanOrdinal(int position) {
        if (position < 0 || position >= booleanOrdinals.length) return -1;
        return booleanOrdinals[position];
    }

    @Override
    public String toString() {
        return name + fields;
    }

    /**
     * Fluent builder assigning positions in call order.
     */
    public static final class Builder {
        private final String name;
        private final List<FieldDescriptor> fields = new ArrayList<>();

        Builder(String name) {
            this.name = name;
        }

        public Builder bool(String fieldName) {
            return field(fieldName, FieldKind.BOOL);
        }

        public Builder int8(String fieldName) {
            return field(fieldName, FieldKind.BYTE);
        }

        public Builder int16(String fieldName) {
            return field(fieldName, FieldKind.SHORT);
        }

        public Builder int32(String fieldName) {
            return field(fieldName, FieldKind.INT32);
        }

        public Builder int32(String fieldName, VarIntMode mode) {
            return field(fieldName, FieldKind.INT32, mode);
        }

        public Builder int64(String fieldName) {
            return field(fieldName, FieldKind.INT64);
        }

        public Builder int64(String fieldName, VarIntMode mode) {
            return field(fieldName, FieldKind.INT64, mode);
        }

        public Builder float32(String fieldName) {
            return field(fieldName, FieldKind.FLOAT32);
        }

        public Builder float64(String fieldName) {
            return field(fieldName, FieldKind.FLOAT64);
        }

        public Builder char16(String fieldName) {
            return field(fieldName, FieldKind.CHAR);
        }

        public Builder string(String fieldName) {
            return field(fieldName, FieldKind.STRING);
        }

        public Builder field(String fieldName, FieldKind kind) {
            return field(fieldName, kind, VarIntMode.NONE);
        }

        public Builder field(String fieldName, FieldKind kind, VarIntMode mode) {
            fields.add(new FieldDescriptor(fields.size(), fieldName, kind, mode, false));
            return this;
        }

        /**
         * Adds a field whose VarInt mode comes from its annotations. Annotations on kinds other
         * than INT32 and INT64 are ignored.
         */
        public Builder field(String fieldName, FieldKind kind, Collection<? extends Annotation> annotations) {
            var mode = kind.supportsVarInt() ? VarIntMode.fromAnnotations(annotations) : VarIntMode.NONE;
            return field(fieldName, kind, mode);
        }

        public Builder nullable(String fieldName, FieldKind kind) {
            fields.add(new FieldDescriptor(fields.size(), fieldName, kind, VarIntMode.NONE, true));
            return this;
        }

        public StructureSchema build() throws BitPackException {
            return new StructureSchema(name, fields);
        }
    }
}
