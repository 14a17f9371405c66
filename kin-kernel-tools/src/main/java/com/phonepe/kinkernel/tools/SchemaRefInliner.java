/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.kinkernel.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.kinkernel.utils.JsonUtils;
import lombok.experimental.UtilityClass;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Replaces local {@code $ref} pointers ({@code #/$defs/...}) with the definitions they point to. Function calling
 * APIs generally do not resolve references, so schemas handed to them need to be self-contained.
 * Inputs are never modified.
 */
@UtilityClass
public class SchemaRefInliner {
    private static final String DEFS = "$defs";
    private static final String REF = "$ref";
    private static final String REF_PREFIX = "#/" + DEFS + "/";

    /**
     * @param schema Schema, possibly with a {@code $defs} section
     * @return Copy of the schema with every reference replaced and {@code $defs} removed
     * @throws SchemaDefinitionException for references without a matching definition, or recursive references
     */
    public static ObjectNode inline(final JsonNode schema) {
        if (!(schema instanceof ObjectNode objectSchema)) {
            throw new SchemaDefinitionException("Schema must be a JSON object");
        }
        final var copy = objectSchema.deepCopy();
        final var defs = copy.remove(DEFS);
        if (JsonUtils.empty(defs) && hasRefs(copy)) {
            throw new SchemaDefinitionException("Schema does not have any " + DEFS + " however it contains some " + REF);
        }
        return (ObjectNode) replaceRefs(copy, defs, new ArrayDeque<>());
    }

    /**
     * Converts an object schema into a function definition:
     * {@code {name: <title>, parameters: {properties, required, type}}}. Other top level keys are kept.
     *
     * @param schema Object schema with a title
     * @return The function definition
     */
    public static ObjectNode toFunctionDefinition(final JsonNode schema) {
        final var inlined = inline(schema);
        final var title = inlined.remove("title");
        if (title == null || !title.isTextual()) {
            throw new SchemaDefinitionException("Schema needs a title to be used as function name");
        }
        final var parameters = parameters(inlined);
        inlined.remove("properties");
        inlined.remove("required");
        inlined.remove("type");
        inlined.put("name", title.asText());
        inlined.set("parameters", parameters);
        return inlined;
    }

    /**
     * @param schema Object schema, already inlined
     * @return {@code {properties, required, type}} of the schema
     */
    static ObjectNode parameters(final ObjectNode schema) {
        final var properties = schema.get("properties");
        if (properties == null || !properties.isObject()) {
            throw new SchemaDefinitionException("Schema does not describe any properties");
        }
        final var parameters = JsonNodeFactory.instance.objectNode();
        parameters.set("properties", properties.deepCopy());
        parameters.set("required", schema.has("required")
                                   ? schema.get("required").deepCopy()
                                   : JsonNodeFactory.instance.arrayNode());
        parameters.put("type", schema.path("type").asText("object"));
        return parameters;
    }

    private static JsonNode replaceRefs(JsonNode node, JsonNode defs, Deque<String> resolving) {
        if (node instanceof ObjectNode objectNode) {
            final var ref = objectNode.get(REF);
            if (ref != null && ref.isTextual()) {
                objectNode.remove(REF);
                final var definition = resolve(ref.asText(), defs, resolving);
                definition.fields().forEachRemaining(field -> objectNode.set(field.getKey(), field.getValue()));
                return objectNode;
            }
            objectNode.fields().forEachRemaining(field -> field.setValue(replaceRefs(field.getValue(), defs, resolving)));
            return objectNode;
        }
        if (node instanceof ArrayNode arrayNode) {
            for (var i = 0; i < arrayNode.size(); i++) {
                arrayNode.set(i, replaceRefs(arrayNode.get(i), defs, resolving));
            }
        }
        return node;
    }

    private static boolean hasRefs(JsonNode node) {
        if (node instanceof ObjectNode objectNode) {
            final var ref = objectNode.get(REF);
            if (ref != null && ref.isTextual()) {
                return true;
            }
        }
        if (node.isContainerNode()) {
            for (final var child : node) {
                if (hasRefs(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static JsonNode resolve(String ref, JsonNode defs, Deque<String> resolving) {
        if (!ref.startsWith(REF_PREFIX)) {
            throw new SchemaDefinitionException("Unsupported reference: " + ref);
        }
        if (resolving.contains(ref)) {
            throw new SchemaDefinitionException("Recursive reference cannot be inlined: " + ref);
        }
        var definition = defs;
        for (final var key : ref.substring(REF_PREFIX.length()).split("/")) {
            definition = definition == null ? null : definition.get(key);
        }
        if (definition == null) {
            throw new SchemaDefinitionException("No definition found for reference: " + ref);
        }
        resolving.push(ref);
        final var resolved = replaceRefs(definition.deepCopy(), defs, resolving);
        resolving.pop();
        return resolved;
    }
}
