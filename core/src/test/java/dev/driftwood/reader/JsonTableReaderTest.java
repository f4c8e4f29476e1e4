/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.driftwood.column.ChunkedColumn;
import dev.driftwood.column.ColumnVector;
import dev.driftwood.column.Table;
import dev.driftwood.memory.MemoryPool;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;
import dev.driftwood.schema.Schema;
import dev.driftwood.schema.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of {@link JsonTableReader}, each run sequentially and with threads.
 */
@Timeout(60)
class JsonTableReaderTest {

    private static final String SCALARS_ONLY = "\n"
            + "    { \"hello\": 3.5, \"world\": false, \"yo\": \"thing\" }\n"
            + "    { \"hello\": 3.25, \"world\": null }\n"
            + "    { \"hello\": 3.125, \"world\": null, \"yo\": \"\\u5fcd\" }\n"
            + "    { \"hello\": 0.0, \"world\": true, \"yo\": null }\n"
            + "  ";

    private static final String NESTED = "\n"
            + "    { \"hello\": 3.5, \"world\": false, \"yo\": \"thing\", \"arr\": [1, 2, 3], \"nuf\": {} }\n"
            + "    { \"hello\": 3.25, \"world\": null, \"arr\": [2], \"nuf\": null }\n"
            + "    { \"hello\": 3.125, \"world\": null, \"yo\": \"\\u5fcd\", \"arr\": [], \"nuf\": { \"ps\": 78 } }\n"
            + "    { \"hello\": 0.0, \"world\": true, \"yo\": null, \"arr\": null, \"nuf\": { \"ps\": 90 } }\n"
            + "  ";

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(UTF_8));
    }

    private static Table read(String text, boolean useThreads) throws DriftwoodException {
        return read(text, ReadOptions.defaults().withUseThreads(useThreads), ParseOptions.defaults());
    }

    private static Table read(String text, ReadOptions readOptions, ParseOptions parseOptions) throws DriftwoodException {
        try (JsonTableReader reader = JsonTableReader.create(MemoryPool.unbounded(), stream(text), readOptions, parseOptions)) {
            return reader.read();
        }
    }

    private static String rowsOfOneColumn(String name, int count) {
        StringBuilder json = new StringBuilder();
        for (int i = 0; i < count; i++) {
            json.append("{\"").append(name).append("\":").append(i).append("}\n");
        }
        return json.toString();
    }

    private static Map<String, Object> struct(Object... keysAndValues) {
        Map<String, Object> struct = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            struct.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return struct;
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testEmptyRecords(boolean useThreads) throws Exception {
        for (String text : List.of("{}\n{}\n", "{}\n{}", "{}\n\r\n{}\n\r\n")) {
            Table table = read(text, useThreads);

            assertThat(table.schema()).isEqualTo(Schema.empty());
            assertThat(table.columnCount()).isZero();
            assertThat(table.rowCount()).isEqualTo(2);
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testEmptyInput(boolean useThreads) throws Exception {
        Table table = read("", useThreads);

        assertThat(table.rowCount()).isZero();
        assertThat(table.columnCount()).isZero();
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testBasics(boolean useThreads) throws Exception {
        Table table = read(SCALARS_ONLY, useThreads);

        assertThat(table.schema()).isEqualTo(Schema.of(
                new Field("hello", FieldType.FLOAT64),
                new Field("world", FieldType.BOOLEAN),
                new Field("yo", FieldType.UTF8)));
        assertThat(table.column("hello").toList()).containsExactly(3.5, 3.25, 3.125, 0.0);
        assertThat(table.column("world").toList()).containsExactly(false, null, null, true);
        assertThat(table.column("yo").toList()).containsExactly("thing", null, "\u5fcd", null);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testNested(boolean useThreads) throws Exception {
        Table table = read(NESTED, useThreads);

        assertThat(table.schema()).isEqualTo(Schema.of(
                new Field("hello", FieldType.FLOAT64),
                new Field("world", FieldType.BOOLEAN),
                new Field("yo", FieldType.UTF8),
                new Field("arr", FieldType.list(FieldType.INT64)),
                new Field("nuf", FieldType.struct(new Field("ps", FieldType.INT64)))));
        assertThat(table.column("arr").toList())
                .containsExactly(List.of(1L, 2L, 3L), List.of(2L), List.of(), null);
        assertThat(table.column("nuf").toList())
                .containsExactly(Collections.singletonMap("ps", null), null, Map.of("ps", 78L), Map.of("ps", 90L));
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testPartialSchema(boolean useThreads) throws Exception {
        Schema explicit = Schema.of(
                new Field("nuf", FieldType.struct(new Field("absent", FieldType.DATE32))),
                new Field("arr", FieldType.list(FieldType.FLOAT32)));

        Table table = read(NESTED, ReadOptions.defaults().withUseThreads(useThreads),
                ParseOptions.defaults().withExplicitSchema(explicit));

        // declared fields come first, followed by inferred ones
        assertThat(table.schema()).isEqualTo(Schema.of(
                new Field("nuf", FieldType.struct(
                        new Field("absent", FieldType.DATE32),
                        new Field("ps", FieldType.INT64))),
                new Field("arr", FieldType.list(FieldType.FLOAT32)),
                new Field("hello", FieldType.FLOAT64),
                new Field("world", FieldType.BOOLEAN),
                new Field("yo", FieldType.UTF8)));
        assertThat(table.column("nuf").toList()).containsExactly(
                struct("absent", null, "ps", null), null, struct("absent", null, "ps", 78L), struct("absent", null, "ps", 90L));
        assertThat(table.column("arr").toList())
                .containsExactly(List.of(1.0f, 2.0f, 3.0f), List.of(2.0f), List.of(), null);
        assertThat(table.column("hello").toList()).containsExactly(3.5, 3.25, 3.125, 0.0);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testExplicitFieldsFirstForAnyBlockSize(boolean useThreads) throws Exception {
        Schema explicit = Schema.of(new Field("f1", FieldType.INT64), new Field("f2", FieldType.UTF8));
        String json = "{\"f3\": true, \"f1\": 1}\n{\"f4\": 2.5, \"f2\": \"x\", \"f3\": false}\n{\"f1\": 3}\n";

        for (int blockSize : new int[]{ 1, 20, 1 << 20 }) {
            Table table = read(json, ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(blockSize),
                    ParseOptions.defaults().withExplicitSchema(explicit));

            assertThat(table.schema()).as("block size %d", blockSize).isEqualTo(Schema.of(
                    new Field("f1", FieldType.INT64),
                    new Field("f2", FieldType.UTF8),
                    new Field("f3", FieldType.BOOLEAN),
                    new Field("f4", FieldType.FLOAT64)));
            assertThat(table.column("f4").toList()).containsExactly(null, 2.5, null);
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testTypeInference(boolean useThreads) throws Exception {
        Table table = read("\n"
                + "    {\"ts\":null, \"f\": null}\n"
                + "    {\"ts\":\"1970-01-01\", \"f\": 3}\n"
                + "    {\"ts\":\"2018-11-13 17:11:10\", \"f\":3.125}\n"
                + "    ", useThreads);

        assertThat(table.schema()).isEqualTo(Schema.of(
                new Field("ts", FieldType.timestamp(TimeUnit.SECOND)),
                new Field("f", FieldType.FLOAT64)));
        assertThat(table.column("ts").toList())
                .containsExactly(null, Instant.EPOCH, Instant.parse("2018-11-13T17:11:10Z"));
        assertThat(table.column("f").toList()).containsExactly(null, 3.0, 3.125);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testMultipleChunks(boolean useThreads) throws Exception {
        Table table = read(SCALARS_ONLY, ReadOptions.defaults().withUseThreads(useThreads)
                .withBlockSize(SCALARS_ONLY.length() / 3), ParseOptions.defaults());

        // the trailing whitespace forms a block of its own, kept as an empty chunk
        for (ChunkedColumn column : table.columns()) {
            assertThat(column.chunks()).extracting(ColumnVector::length).containsExactly(2, 2, 0);
        }
        assertThat(table.column("hello").toList()).containsExactly(3.5, 3.25, 3.125, 0.0);
        assertThat(table.column("world").toList()).containsExactly(false, null, null, true);
        assertThat(table.column("yo").toList()).containsExactly("thing", null, "\u5fcd", null);
        assertThat(table.contentEquals(read(SCALARS_ONLY, useThreads))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testWhitespaceOnlyBlockIsEmptyChunk(boolean useThreads) throws Exception {
        Table table = read("{\"a\":1}\n   ", ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(8),
                ParseOptions.defaults());

        assertThat(table.rowCount()).isEqualTo(1);
        assertThat(table.column("a").chunks()).extracting(ColumnVector::length).containsExactly(1, 0);
        assertThat(table.column("a").chunk(1).type()).isEqualTo(FieldType.INT64);
        assertThat(table.column("a").toList()).containsExactly(1L);
    }

    @Test
    void testMultipleChunksParallel() throws Exception {
        int count = 1 << 10;
        String json = rowsOfOneColumn("a", count);
        ReadOptions options = ReadOptions.defaults().withBlockSize(count / 2);

        Table threaded = read(json, options.withUseThreads(true), ParseOptions.defaults());
        Table serial = read(json, options.withUseThreads(false), ParseOptions.defaults());

        assertThat(serial.column(0).field().type()).isEqualTo(FieldType.INT64);
        assertThat(serial.column(0).chunkCount()).isGreaterThan(1);
        long expected = 0;
        for (ColumnVector chunk : serial.column(0).chunks()) {
            ColumnVector.Int64Vector ints = (ColumnVector.Int64Vector) chunk;
            for (int i = 0; i < ints.length(); i++) {
                assertThat(ints.get(i)).as("value at %d", expected).isEqualTo(expected);
                expected++;
            }
        }
        assertThat(expected).isEqualTo(count);
        assertThat(threaded.contentEquals(serial)).isTrue();
        assertThat(threaded.column(0).chunkCount()).isEqualTo(serial.column(0).chunkCount());
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testListArrayWithFewValues(boolean useThreads) throws Exception {
        Table table = read("{\"a\": [1], \"b\": {\"c\": true, \"d\": \"1991-02-03\"}}\n"
                + "{\"a\": [], \"b\": {\"c\": false, \"d\": \"2019-04-01\"}}\n", useThreads);

        assertThat(table.schema()).isEqualTo(Schema.of(
                new Field("a", FieldType.list(FieldType.INT64)),
                new Field("b", FieldType.struct(
                        new Field("c", FieldType.BOOLEAN),
                        new Field("d", FieldType.timestamp(TimeUnit.SECOND))))));
        assertThat(table.column("a").toList()).containsExactly(List.of(1L), List.of());
        assertThat(table.column("b").toList()).containsExactly(
                struct("c", true, "d", Instant.parse("1991-02-03T00:00:00Z")),
                struct("c", false, "d", Instant.parse("2019-04-01T00:00:00Z")));
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testFixedSizeList(boolean useThreads) throws Exception {
        Schema explicit = Schema.of(new Field("a", FieldType.fixedSizeList(FieldType.INT64, 3)));
        ParseOptions parseOptions = ParseOptions.defaults().withExplicitSchema(explicit);
        ReadOptions readOptions = ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(15);

        Table table = read("{\"a\": [1,2,3]}\n{\"a\": [4,5,6]}\n", readOptions, parseOptions);
        assertThat(table.column("a").toList()).containsExactly(List.of(1L, 2L, 3L), List.of(4L, 5L, 6L));
        assertThat(table.combineChunks().column("a").chunkCount()).isEqualTo(1);

        assertThatThrownBy(() -> read("{\"a\": [1,2,3,4,5,6,7,8,9,10,11,12]}", readOptions, parseOptions))
                .isInstanceOf(SchemaException.class);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testList(boolean useThreads) throws Exception {
        Table table = read("{\"a\": [1, 2, 3]}\n{\"a\": [4, 5, 6, 7]}\n", useThreads);

        assertThat(table.column("a").toList()).containsExactly(List.of(1L, 2L, 3L), List.of(4L, 5L, 6L, 7L));
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testExplicitSchemaTypes(boolean useThreads) throws Exception {
        Schema explicit = Schema.of(
                new Field("id", FieldType.INT64),
                new Field("at", FieldType.timestamp(TimeUnit.MILLI)),
                new Field("day", FieldType.DATE32),
                new Field("score", FieldType.FLOAT64),
                new Field("ratio", FieldType.FLOAT32),
                new Field("missing", FieldType.UTF8));

        Table table = read("{\"id\": 1, \"at\": \"2020-05-06T07:08:09.010Z\", \"day\": \"2020-05-06\", \"score\": 7, \"ratio\": 0.5}\n"
                + "{\"id\": 2, \"at\": null, \"day\": null, \"score\": 0.5, \"ratio\": 2}\n",
                ReadOptions.defaults().withUseThreads(useThreads), ParseOptions.defaults().withExplicitSchema(explicit));

        assertThat(table.schema()).isEqualTo(explicit);
        assertThat(table.column("at").toList()).containsExactly(Instant.parse("2020-05-06T07:08:09.010Z"), null);
        assertThat(table.column("day").toList()).containsExactly(LocalDate.of(2020, 5, 6), null);
        assertThat(table.column("score").toList()).containsExactly(7.0, 0.5);
        assertThat(table.column("ratio").toList()).containsExactly(0.5f, 2.0f);
        assertThat(table.column("missing").toList()).containsExactly(null, null);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testUnexpectedFieldBehaviors(boolean useThreads) throws Exception {
        Schema explicit = Schema.of(new Field("a", FieldType.INT64));
        String json = "{\"a\": 1, \"b\": \"x\"}\n";
        ReadOptions readOptions = ReadOptions.defaults().withUseThreads(useThreads);

        Table ignored = read(json, readOptions, new ParseOptions(UnexpectedFieldBehavior.IGNORE, explicit));
        assertThat(ignored.schema()).isEqualTo(explicit);

        Table inferred = read(json, readOptions, new ParseOptions(UnexpectedFieldBehavior.INFER_TYPE, explicit));
        assertThat(inferred.schema().getFieldCount()).isEqualTo(2);

        assertThatThrownBy(() -> read(json, readOptions, new ParseOptions(UnexpectedFieldBehavior.ERROR, explicit)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("'b'");
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testPromotionAcrossBlocks(boolean useThreads) throws Exception {
        Table table = read("{\"a\": 1}\n{\"b\": [null]}\n{\"a\": 2.5, \"b\": [\"x\"]}\n",
                ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(1), ParseOptions.defaults());

        assertThat(table.column("a").chunkCount()).isEqualTo(3);
        assertThat(table.column("a").toList()).containsExactly(1.0, null, 2.5);
        assertThat(table.column("b").field().type()).isEqualTo(FieldType.list(FieldType.UTF8));
        List<Object> nullElement = new ArrayList<>();
        nullElement.add(null);
        assertThat(table.column("b").toList()).containsExactly(null, nullElement, List.of("x"));
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testBlockSizeDoesNotChangeContent(boolean useThreads) throws Exception {
        String json = NESTED + "\n" + rowsOfOneColumn("hello", 100);

        Table small = read(json, ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(1), ParseOptions.defaults());
        Table large = read(json, ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(1 << 24), ParseOptions.defaults());

        assertThat(small.contentEquals(large)).isTrue();
        assertThat(large.column("hello").chunkCount()).isEqualTo(1);
        assertThat(small.column("hello").chunkCount()).isGreaterThan(100);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testMaximumBlockSize(boolean useThreads) throws Exception {
        Table table = read("{\"a\":1}\n", ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(Integer.MAX_VALUE),
                ParseOptions.defaults());

        assertThat(table.column("a").toList()).containsExactly(1L);
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testConflictAcrossBlocks(boolean useThreads) {
        assertThatThrownBy(() -> read("{\"a\": 1}\n{\"a\": \"x\"}\n",
                ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(1), ParseOptions.defaults()))
                .isInstanceOf(TypeConflictException.class)
                .hasMessageContaining("'a'");
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testMalformedRecord(boolean useThreads) {
        assertThatThrownBy(() -> read("{\"a\": 1}\n{\"a\" 1}\n", useThreads))
                .isInstanceOf(RecordParseException.class)
                .hasMessageContaining("line 2");
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testLowestFailingBlockIsReported(boolean useThreads) {
        String json = rowsOfOneColumn("a", 10) + "{broken\n" + rowsOfOneColumn("a", 10) + "[1]\n" + rowsOfOneColumn("a", 10);

        assertThatThrownBy(() -> read(json, ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(1),
                ParseOptions.defaults()))
                .isInstanceOf(RecordParseException.class)
                .hasMessageContaining("block 10,");
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testMemoryLimit(boolean useThreads) {
        MemoryPool pool = MemoryPool.bounded(1024);
        String json = rowsOfOneColumn("a", 5_000);

        assertThatThrownBy(() -> {
            try (JsonTableReader reader = JsonTableReader.create(pool, stream(json),
                    ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(4096), ParseOptions.defaults())) {
                reader.read();
            }
        }).isInstanceOf(AllocationException.class);
        assertThat(pool.bytesAllocated()).isZero();
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testTableHoldsMemoryUntilClosed(boolean useThreads) throws Exception {
        MemoryPool pool = MemoryPool.unbounded();

        try (JsonTableReader reader = JsonTableReader.create(pool, stream(NESTED),
                ReadOptions.defaults().withUseThreads(useThreads).withBlockSize(64), ParseOptions.defaults())) {
            Table table = reader.read();
            assertThat(pool.bytesAllocated()).isPositive();
            table.close();
        }
        assertThat(pool.bytesAllocated()).isZero();
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testReadTwice(boolean useThreads) throws Exception {
        try (JsonTableReader reader = JsonTableReader.create(MemoryPool.unbounded(), stream("{}\n"),
                ReadOptions.defaults().withUseThreads(useThreads), ParseOptions.defaults())) {
            reader.read();
            assertThatThrownBy(reader::read).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void testReadAfterFailure() throws Exception {
        try (JsonTableReader reader = JsonTableReader.create(MemoryPool.unbounded(), stream("not json\n"),
                ReadOptions.defaults(), ParseOptions.defaults())) {
            assertThatThrownBy(reader::read).isInstanceOf(RecordParseException.class);
            assertThatThrownBy(reader::read).isInstanceOf(IllegalStateException.class);
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void testStreamFailure(boolean useThreads) {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("boom");
            }
        };

        assertThatThrownBy(() -> {
            try (JsonTableReader reader = JsonTableReader.create(MemoryPool.unbounded(), failing,
                    ReadOptions.defaults().withUseThreads(useThreads), ParseOptions.defaults())) {
                reader.read();
            }
        }).isInstanceOf(StreamException.class)
                .hasRootCauseMessage("boom");
    }

    @Test
    void testInvalidConfiguration() {
        MemoryPool pool = MemoryPool.unbounded();

        assertThatThrownBy(() -> JsonTableReader.create(pool, stream("{}"), ReadOptions.defaults().withBlockSize(0),
                ParseOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Block size");
        assertThatThrownBy(() -> JsonTableReader.create(null, stream("{}"), ReadOptions.defaults(), ParseOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonTableReader.create(pool, null, ReadOptions.defaults(), ParseOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonTableReader.create(pool, stream("{}"), null, ParseOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonTableReader.create(pool, stream("{}"), ReadOptions.defaults(),
                new ParseOptions(null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSharedContext() throws Exception {
        try (DriftwoodContext context = DriftwoodContext.create(2)) {
            ReadOptions options = ReadOptions.defaults().withUseThreads(true).withBlockSize(32);
            for (int i = 0; i < 3; i++) {
                try (JsonTableReader reader = JsonTableReader.create(context, MemoryPool.unbounded(),
                        stream(rowsOfOneColumn("n", 100)), options, ParseOptions.defaults())) {
                    assertThat(reader.read().column("n").length()).isEqualTo(100);
                }
            }
            assertThat(context.executor().isShutdown()).isFalse();
        }
    }

    @Test
    void testGzipCompressedStream() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write(SCALARS_ONLY.getBytes(UTF_8));
        }

        Table table;
        try (JsonTableReader reader = JsonTableReader.create(MemoryPool.unbounded(),
                new ByteArrayInputStream(bytes.toByteArray()),
                ReadOptions.defaults().withCompression(InputCompression.GZIP), ParseOptions.defaults())) {
            table = reader.read();
        }

        assertThat(table.contentEquals(read(SCALARS_ONLY, false))).isTrue();
    }
}
