/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;

import dev.driftwood.internal.segment.Block;
import dev.driftwood.reader.ParseOptions;
import dev.driftwood.reader.RecordParseException;
import dev.driftwood.reader.SchemaException;
import dev.driftwood.reader.UnexpectedFieldBehavior;
import dev.driftwood.schema.Field;
import dev.driftwood.schema.FieldType;

/**
 * Parses the records of a {@link Block} into {@link Row}s.
 * <p>
 * Every non-blank line must hold exactly one JSON object. Parsing descends recursively while
 * carrying the type the explicit schema declares for the current position, so that fields
 * unknown to a declared struct can be skipped or rejected as they are encountered. Inside
 * values of undeclared fields there is no such context and every member is kept.
 * </p>
 * <p>
 * Instances hold no per-block state and may be shared between threads.
 * </p>
 */
public final class RowParser {

    /** Shared factory; thread-safe once configured. */
    private static final JsonFactory JSON_FACTORY = createJsonFactory();

    private final UnexpectedFieldBehavior unexpectedFieldBehavior;
    private final FieldType.StructType rootType;

    public RowParser(ParseOptions options) {
        this.unexpectedFieldBehavior = options.unexpectedFieldBehavior();
        this.rootType = options.explicitSchemaOrEmpty().asStruct();
    }

    private static JsonFactory createJsonFactory() {
        JsonFactory factory = new JsonFactory();
        factory.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
        return factory;
    }

    /**
     * Parses all records of the block, skipping blank lines.
     */
    public List<Row> parse(Block block) throws RecordParseException, SchemaException {
        byte[] data = block.data();
        List<Row> rows = new ArrayList<>();
        int line = 0;
        int start = 0;
        while (start < data.length) {
            int end = start;
            while (end < data.length && data[end] != '\n') {
                end++;
            }
            line++;
            int contentEnd = end;
            if (contentEnd > start && data[contentEnd - 1] == '\r') {
                contentEnd--;
            }
            if (!isBlank(data, start, contentEnd)) {
                JsonValue.ObjectValue record = parseRecord(data, start, contentEnd - start, block.index(), line);
                rows.add(new Row(block.index(), rows.size(), line, record));
            }
            start = end + 1;
        }
        return rows;
    }

    private static boolean isBlank(byte[] data, int from, int to) {
        for (int i = from; i < to; i++) {
            byte b = data[i];
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }

    private JsonValue.ObjectValue parseRecord(byte[] data, int offset, int length, long blockIndex, int line)
            throws RecordParseException, SchemaException {
        String where = "block " + blockIndex + ", line " + line;
        try (JsonParser parser = JSON_FACTORY.createParser(data, offset, length)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new RecordParseException("Expected a JSON object at " + where + " but found "
                        + describe(token));
            }
            JsonValue.ObjectValue record = readObject(parser, rootType, "", where);
            JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new RecordParseException("Unexpected " + describe(trailing) + " after the record at "
                        + where + ", column " + parser.currentLocation().getColumnNr());
            }
            return record;
        }
        catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            String column = location != null ? ", column " + location.getColumnNr() : "";
            throw new RecordParseException("Malformed JSON at " + where + column + ": " + e.getOriginalMessage(), e);
        }
        catch (IOException e) {
            throw new RecordParseException("Failed to parse record at " + where, e);
        }
    }

    /**
     * Reads the members of an object whose START_OBJECT token is current.
     *
     * @param declared the declared struct type at this position, or null inside undeclared values
     */
    private JsonValue.ObjectValue readObject(JsonParser parser, FieldType.StructType declared, String path, String where)
            throws IOException, RecordParseException, SchemaException {
        LinkedHashMap<String, JsonValue> members = new LinkedHashMap<>();
        JsonToken token;
        while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
            String name = parser.currentName();
            String childPath = path.isEmpty() ? name : path + "." + name;
            FieldType childType = null;
            if (declared != null) {
                Field field = declared.field(name);
                if (field != null) {
                    childType = field.type();
                }
                else if (unexpectedFieldBehavior == UnexpectedFieldBehavior.IGNORE) {
                    parser.nextToken();
                    parser.skipChildren();
                    continue;
                }
                else if (unexpectedFieldBehavior == UnexpectedFieldBehavior.ERROR) {
                    throw new SchemaException("Unexpected field '" + childPath + "' at " + where);
                }
            }
            parser.nextToken();
            members.put(name, readValue(parser, childType, childPath, where));
        }
        if (token != JsonToken.END_OBJECT) {
            throw new RecordParseException("Unexpected " + describe(token) + " in object '" + path + "' at " + where);
        }
        return JsonValue.ObjectValue.of(members);
    }

    private JsonValue readValue(JsonParser parser, FieldType declared, String path, String where)
            throws IOException, RecordParseException, SchemaException {
        JsonToken token = parser.currentToken();
        if (token == null) {
            throw new RecordParseException("Unexpected end of record in '" + path + "' at " + where);
        }
        switch (token) {
            case START_OBJECT:
                return readObject(parser, declared instanceof FieldType.StructType struct ? struct : null, path, where);
            case START_ARRAY:
                return readArray(parser, elementTypeOf(declared), path, where);
            case VALUE_STRING:
                return new JsonValue.StringValue(parser.getText());
            case VALUE_NUMBER_INT:
                if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                    throw new RecordParseException("Integer " + parser.getText() + " in '" + path
                            + "' at " + where + " does not fit in 64 bits");
                }
                return new JsonValue.IntValue(parser.getLongValue());
            case VALUE_NUMBER_FLOAT:
                return new JsonValue.FloatValue(parser.getDoubleValue());
            case VALUE_TRUE:
                return new JsonValue.BoolValue(true);
            case VALUE_FALSE:
                return new JsonValue.BoolValue(false);
            case VALUE_NULL:
                return JsonValue.NullValue.INSTANCE;
            default:
                throw new RecordParseException("Unexpected " + describe(token) + " in '" + path + "' at " + where);
        }
    }

    private JsonValue.ArrayValue readArray(JsonParser parser, FieldType declaredElement, String path, String where)
            throws IOException, RecordParseException, SchemaException {
        List<JsonValue> elements = new ArrayList<>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, declaredElement, path + "[]", where));
        }
        return new JsonValue.ArrayValue(elements);
    }

    private static FieldType elementTypeOf(FieldType declared) {
        if (declared instanceof FieldType.ListType list) {
            return list.elementType();
        }
        if (declared instanceof FieldType.FixedSizeListType fixedSizeList) {
            return fixedSizeList.elementType();
        }
        return null;
    }

    private static String describe(JsonToken token) {
        if (token == null) {
            return "end of input";
        }
        return switch (token) {
            case START_ARRAY -> "array";
            case VALUE_STRING -> "string";
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> "number";
            case VALUE_TRUE, VALUE_FALSE -> "boolean";
            case VALUE_NULL -> "null";
            default -> token.asString() != null ? "'" + token.asString() + "'" : token.name();
        };
    }
}
