/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.assembly;

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.driftwood.column.ColumnVector;
import dev.driftwood.memory.MemoryAccount;
import dev.driftwood.memory.MemoryPool;
import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnPromoterTest {

    private final MemoryAccount account = new MemoryAccount(MemoryPool.unbounded());

    @Test
    void testSameTypeIsUnchanged() throws Exception {
        ColumnVector ints = new ColumnVector.Int64Vector(new long[]{ 1 }, null, 1);

        assertThat(ColumnPromoter.promote(ints, FieldType.INT64, account, "a")).isSameAs(ints);
    }

    @Test
    void testNullSegmentBecomesTypedNulls() throws Exception {
        FieldType target = FieldType.list(FieldType.UTF8);

        ColumnVector promoted = ColumnPromoter.promote(new ColumnVector.NullVector(3), target, account, "a");

        assertThat(promoted.type()).isEqualTo(target);
        assertThat(promoted.toList()).containsExactly(null, null, null);
    }

    @Test
    void testIntegersWidenToDoubles() throws Exception {
        BitSet nulls = new BitSet();
        nulls.set(1);
        ColumnVector ints = new ColumnVector.Int64Vector(new long[]{ 7, 0 }, nulls, 2);

        ColumnVector promoted = ColumnPromoter.promote(ints, FieldType.FLOAT64, account, "a");

        assertThat(promoted).isInstanceOf(ColumnVector.Float64Vector.class);
        assertThat(promoted.toList()).containsExactly(7.0, null);
    }

    @Test
    void testFloatsWidenToDoubles() throws Exception {
        BitSet nulls = new BitSet();
        nulls.set(0);
        ColumnVector floats = new ColumnVector.Float32Vector(new float[]{ 0f, 1.5f }, nulls, 2);

        ColumnVector promoted = ColumnPromoter.promote(floats, FieldType.FLOAT64, account, "a");

        assertThat(promoted).isInstanceOf(ColumnVector.Float64Vector.class);
        assertThat(promoted.toList()).containsExactly(null, 1.5);
    }

    @Test
    void testListElementsArePromoted() throws Exception {
        ColumnVector list = new ColumnVector.ListVector(FieldType.list(FieldType.INT64), new int[]{ 0, 2 },
                new ColumnVector.Int64Vector(new long[]{ 1, 2 }, null, 2), null, 1);

        ColumnVector promoted = ColumnPromoter.promote(list, FieldType.list(FieldType.FLOAT64), account, "a");

        assertThat(promoted.toList()).containsExactly(List.of(1.0, 2.0));
    }

    @Test
    void testStructIsReorderedAndFilled() throws Exception {
        FieldType.StructType source = FieldType.struct(new Field("b", FieldType.INT64));
        ColumnVector struct = new ColumnVector.StructVector(source,
                List.of(new ColumnVector.Int64Vector(new long[]{ 5 }, null, 1)), null, 1);
        FieldType.StructType target = FieldType.struct(
                new Field("a", FieldType.DATE32),
                new Field("b", FieldType.FLOAT64));

        ColumnVector promoted = ColumnPromoter.promote(struct, target, account, "s");

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("a", null);
        expected.put("b", 5.0);
        assertThat(promoted.type()).isEqualTo(target);
        assertThat(promoted.getObject(0)).isEqualTo(expected);
        assertThat(((ColumnVector.StructVector) promoted).child("a").length()).isEqualTo(1);
    }

    @Test
    void testNestedNullsKeepChildrenAligned() throws Exception {
        FieldType target = FieldType.struct(new Field("xs", FieldType.fixedSizeList(FieldType.BOOLEAN, 2)));

        ColumnVector nulls = ColumnPromoter.nulls(target, 2, account, "s");

        ColumnVector.StructVector struct = (ColumnVector.StructVector) nulls;
        ColumnVector.FixedSizeListVector xs = (ColumnVector.FixedSizeListVector) struct.child(0);
        assertThat(struct.toList()).containsExactly(null, null);
        assertThat(xs.length()).isEqualTo(2);
        assertThat(xs.values().length()).isEqualTo(4);
        assertThat(Collections.frequency(xs.values().toList(), null)).isEqualTo(4);
    }

    @Test
    void testIncompatibleSegment() {
        ColumnVector strings = new ColumnVector.Utf8Vector(new String[]{ "x" }, null, 1);

        assertThatThrownBy(() -> ColumnPromoter.promote(strings, FieldType.INT64, account, "a"))
                .isInstanceOf(TypeConflictException.class)
                .hasMessageContaining("'a'");
    }
}
