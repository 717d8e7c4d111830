package com.bitpack.schema;

import com.bitpack.error.BitPackException;
import com.bitpack.error.ErrorType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StructureSchemaTest {

    @Test
    void shouldAssignPositionsInDeclarationOrder() throws BitPackException {
        var schema = StructureSchema.builder("Entry")
            .int64("timestamp")
            .bool("error")
            .string("message")
            .build();

        assertThat(schema.fieldCount()).isEqualTo(3);
        assertThat(schema.getFields())
            .extracting(FieldDescriptor::getPosition)
            .containsExactly(0, 1, 2);
        assertThat(schema.field(2).getKind()).isEqualTo(FieldKind.STRING);
    }

    @Test
    void shouldDeriveBooleanOrdinalsFromDeclarationOrder() throws BitPackException {
        var schema = StructureSchema.builder("Mixed")
            .int32("a")
            .string("b")
            .bool("c")
            .int8("d")
            .int32("e")
            .bool("f")
            .int16("g")
            .bool("h")
            .build();

        assertThat(schema.getBooleanPositions().toIntArray()).containsExactly(2, 5, 7);
        assertThat(schema.booleanCount()).isEqualTo(3);
        assertThat(schema.booleanOrdinal(2)).isEqualTo(0);
        assertThat(schema.booleanOrdinal(5)).isEqualTo(1);
        assertThat(schema.booleanOrdinal(7)).isEqualTo(2);
        assertThat(schema.booleanOrdinal(0)).isEqualTo(-1);
        assertThat(schema.booleanOrdinal(42)).isEqualTo(-1);
        assertThat(schema.hasLongFlags()).isFalse();
    }

    @Test
    void shouldRejectNonContiguousPositions() {
        assertThatThrownBy(() -> StructureSchema.of("Gap",
                FieldDescriptor.of(0, "a", FieldKind.INT32),
                FieldDescriptor.of(2, "b", FieldKind.INT32)))
            .isInstanceOf(BitPackException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.SCHEMA_ERROR);
    }

    @Test
    void shouldRejectIncompleteFieldDescriptors() {
        assertThatThrownBy(() -> StructureSchema.of("NoKind", new FieldDescriptor(0, "a", null, VarIntMode.NONE, false)))
            .isInstanceOf(BitPackException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.SCHEMA_ERROR);
        assertThatThrownBy(() -> StructureSchema.of("NoMode", new FieldDescriptor(0, "a", FieldKind.INT32, null, false)))
            .isInstanceOf(BitPackException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.SCHEMA_ERROR);
        assertThatThrownBy(() -> StructureSchema.of("NoField", (FieldDescriptor) null))
            .isInstanceOf(BitPackException.class)
            .hasMessageContaining("index 0");
    }

    @Test
    void shouldRejectVarIntModeOnNonIntegerField() {
        assertThatThrownBy(() -> StructureSchema.of("Bad",
                FieldDescriptor.of(0, "name", FieldKind.STRING, VarIntMode.SIGNED)))
            .isInstanceOf(BitPackException.class)
            .hasMessageContaining("name");
    }

    @Test
    void shouldSwitchToLongFlagsAbove32Booleans() throws BitPackException {
        var builder = StructureSchema.builder("Wide");
        for (int i = 0; i < 33; i++) {
            builder.bool("b" + i);
        }

        assertThat(builder.build().hasLongFlags()).isTrue();
    }

    @Test
    void shouldRejectMoreThan64Booleans() {
        var builder = StructureSchema.builder("TooWide");
        for (int i = 0; i < 65; i++) {
            builder.bool("b" + i);
        }

        assertThatThrownBy(builder::build)
            .isInstanceOf(BitPackException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.SCHEMA_ERROR);
    }

    @Test
    void shouldRejectPositionOutsideSchema() throws BitPackException {
        var schema = StructureSchema.builder("One").int32("a").build();

        assertThatThrownBy(() -> schema.field(1))
            .isInstanceOf(BitPackException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.SCHEMA_ERROR);
    }

    @Test
    void shouldBeImmutable() throws BitPackException {
        var fields = new ArrayList<FieldDescriptor>(List.of(FieldDescriptor.of(0, "a", FieldKind.BOOL)));
        var schema = StructureSchema.of("Copy", fields);

        fields.add(FieldDescriptor.of(1, "b", FieldKind.BOOL));

        assertThat(schema.fieldCount()).isEqualTo(1);
        assertThatThrownBy(() -> schema.getBooleanPositions().add(3))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldCompareByNameAndFields() throws BitPackException {
        var first = StructureSchema.builder("Same").int32("a", VarIntMode.ZIGZAG).bool("b").build();
        var second = StructureSchema.builder("Same").int32("a", VarIntMode.ZIGZAG).bool("b").build();
        var other = StructureSchema.builder("Same").int32("a").bool("b").build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(other);
    }

    @Test
    void shouldIgnoreAnnotationsOnNonIntegerKinds() throws BitPackException {
        var annotated = RecordSchemasTest.Annotated.class.getRecordComponents()[0].getAnnotations();
        var schema = StructureSchema.builder("Ignored")
            .field("text", FieldKind.STRING, List.of(annotated))
            .field("count", FieldKind.INT64, List.of(annotated))
            .build();

        assertThat(schema.field(0).getVarIntMode()).isEqualTo(VarIntMode.NONE);
        assertThat(schema.field(1).getVarIntMode()).isEqualTo(VarIntMode.SIGNED);
    }
}
