/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed but untyped JSON value.
 * <p>
 * Types are assigned later: by inference for undeclared fields, or by conversion into the
 * declared type for fields of an explicit schema.
 * </p>
 */
public sealed interface JsonValue
        permits JsonValue.NullValue, JsonValue.BoolValue, JsonValue.IntValue, JsonValue.FloatValue,
        JsonValue.StringValue, JsonValue.ArrayValue, JsonValue.ObjectValue {

    /** Short name of the JSON kind, for error messages. */
    String kind();

    default boolean isNull() {
        return false;
    }

    enum NullValue implements JsonValue {
        INSTANCE;

        @Override
        public String kind() {
            return "null";
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements JsonValue {
        @Override
        public String kind() {
            return "boolean";
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record IntValue(long value) implements JsonValue {
        @Override
        public String kind() {
            return "integer";
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements JsonValue {
        @Override
        public String kind() {
            return "float";
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record StringValue(String value) implements JsonValue {
        @Override
        public String kind() {
            return "string";
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record ArrayValue(List<JsonValue> elements) implements JsonValue {
        public ArrayValue {
            elements = Collections.unmodifiableList(elements);
        }

        public int size() {
            return elements.size();
        }

        @Override
        public String kind() {
            return "array";
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    /**
     * An object; members keep the order in which their keys first appeared.
     */
    record ObjectValue(Map<String, JsonValue> members) implements JsonValue {
        public ObjectValue {
            members = Collections.unmodifiableMap(members);
        }

        static ObjectValue of(LinkedHashMap<String, JsonValue> members) {
            return new ObjectValue(members);
        }

        /**
         * The member's value, or null if the key is absent.
         */
        public JsonValue get(String name) {
            return members.get(name);
        }

        @Override
        public String kind() {
            return "object";
        }

        @Override
        public String toString() {
            return members.toString();
        }
    }
}
