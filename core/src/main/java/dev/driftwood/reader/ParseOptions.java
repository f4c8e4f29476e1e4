/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import dev.driftwood.schema.Schema;

/**
 * Options controlling how records are mapped onto fields.
 *
 * @param unexpectedFieldBehavior treatment of fields the explicit schema does not declare
 * @param explicitSchema declared fields whose types are authoritative, or null to infer all fields
 */
public record ParseOptions(UnexpectedFieldBehavior unexpectedFieldBehavior, Schema explicitSchema) {

    /**
     * Infers every field, with no explicit schema.
     */
    public static ParseOptions defaults() {
        return new ParseOptions(UnexpectedFieldBehavior.INFER_TYPE, null);
    }

    public ParseOptions withUnexpectedFieldBehavior(UnexpectedFieldBehavior behavior) {
        return new ParseOptions(behavior, explicitSchema);
    }

    public ParseOptions withExplicitSchema(Schema schema) {
        return new ParseOptions(unexpectedFieldBehavior, schema);
    }

    /**
     * The explicit schema, or an empty schema if none was given.
     */
    public Schema explicitSchemaOrEmpty() {
        return explicitSchema != null ? explicitSchema : Schema.empty();
    }
}
