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

package com.phonepe.kinkernel.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.InvalidNullException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.google.common.base.CaseFormat;
import com.google.common.base.Throwables;
import com.google.common.primitives.Primitives;
import com.phonepe.kinkernel.utils.JsonUtils;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Binds a schema type to the mapper and validator used to parse untyped data into it. Parsing is done in two
 * passes: structural mapping with Jackson (shape, types, required members), then constraint checks with
 * jakarta validation. Instances are immutable and safe to share between threads.
 *
 * <p>Accepted raw inputs are JSON text ({@link String}), {@link JsonNode} trees, maps and any object Jackson can
 * serialize. Strings are always treated as JSON documents.</p>
 *
 * @param <T> The schema type
 */
@Slf4j
public class SchemaBinding<T> {
    private static final Pattern MISSING_CREATOR_PROPERTY = Pattern.compile("Missing required creator property '([^']+)'");
    private static final Pattern NULL_CREATOR_PROPERTY = Pattern.compile("Null value for creator property '([^']+)'");

    @Getter
    private final Class<T> type;
    private final ObjectMapper mapper;
    private final Validator validator;
    private final JsonNode schema;

    public SchemaBinding(@NonNull Class<T> type, @NonNull ObjectMapper mapper, @NonNull Validator validator) {
        this.type = type;
        this.mapper = mapper;
        this.validator = validator;
        this.schema = JsonUtils.schema(type);
    }

    /**
     * Schema generated for the bound type when this binding was created. Every call returns an equal copy.
     *
     * @return JSON schema of the type
     */
    public JsonNode getSchema() {
        return schema.deepCopy();
    }

    /**
     * Parse untyped data into the schema type
     *
     * @param raw Data to parse
     * @return The typed value or the list of failures
     */
    public ParseResult<T> parse(final Object raw) {
        if (raw == null) {
            return ParseResult.failure(ValidationFailure.root("required", "Input should not be null"));
        }
        final JsonNode tree;
        try {
            tree = toTree(raw);
        }
        catch (JsonProcessingException e) {
            log.debug("Could not read JSON for {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return ParseResult.failure(ValidationFailure.root("json_invalid", "Invalid JSON: " + originalMessage(e)));
        }
        catch (IllegalArgumentException e) {
            return ParseResult.failure(ValidationFailure.root("serialization",
                                                              "Value could not be converted to JSON: "
                                                                      + rootCauseMessage(e)));
        }
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return ParseResult.failure(ValidationFailure.root("required", "Input should not be null"));
        }
        final T value;
        try {
            value = mapper.treeToValue(tree, type);
        }
        catch (JsonProcessingException e) {
            log.debug("Structural validation failed for {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return ParseResult.failure(toFailure(e));
        }
        final var violations = validator.validate(value);
        if (!violations.isEmpty()) {
            return ParseResult.failure(violations.stream()
                                               .map(SchemaBinding::toFailure)
                                               .sorted(Comparator.comparing(ValidationFailure::getPath)
                                                               .thenComparing(ValidationFailure::getRule))
                                               .toList());
        }
        return ParseResult.success(value);
    }

    private JsonNode toTree(final Object raw) throws JsonProcessingException {
        if (raw instanceof JsonNode node) {
            return node;
        }
        if (raw instanceof String json) {
            return mapper.readTree(json);
        }
        return mapper.valueToTree(raw);
    }

    private static ValidationFailure toFailure(JsonProcessingException e) {
        if (!(e instanceof JsonMappingException mappingException)) {
            return ValidationFailure.root("json_invalid", "Invalid JSON: " + originalMessage(e));
        }
        final var path = toPath(mappingException.getPath());
        if (e instanceof InvalidNullException) {
            return new ValidationFailure(path, "not_null", "Input should not be null");
        }
        if (e instanceof InvalidFormatException formatException
                && formatException.getTargetType() != null
                && formatException.getTargetType().isEnum()) {
            return new ValidationFailure(path,
                                         "enum",
                                         "Input should be one of " + Arrays.toString(formatException.getTargetType()
                                                                                             .getEnumConstants()));
        }
        if (e instanceof MismatchedInputException mismatch) {
            final var message = Objects.requireNonNullElse(e.getOriginalMessage(), "");
            final var missing = MISSING_CREATOR_PROPERTY.matcher(message);
            if (missing.find()) {
                return new ValidationFailure(path + "." + missing.group(1), "required", "Field required");
            }
            final var nullValue = NULL_CREATOR_PROPERTY.matcher(message);
            if (nullValue.find()) {
                return new ValidationFailure(path + "." + nullValue.group(1), "not_null", "Input should not be null");
            }
            return new ValidationFailure(path, "type", "Input should be a valid " + jsonType(mismatch.getTargetType()));
        }
        if (e instanceof ValueInstantiationException) {
            return new ValidationFailure(path, "value", rootCauseMessage(e));
        }
        return new ValidationFailure(path, "parse", originalMessage(e));
    }

    private static String originalMessage(JsonProcessingException e) {
        return Objects.requireNonNullElse(e.getOriginalMessage(), e.getClass().getSimpleName());
    }

    private static String rootCauseMessage(Throwable e) {
        final var rootCause = Throwables.getRootCause(e);
        return Objects.requireNonNullElse(rootCause.getMessage(), rootCause.getClass().getSimpleName());
    }

    private static ValidationFailure toFailure(ConstraintViolation<?> violation) {
        final var propertyPath = violation.getPropertyPath().toString();
        final var rule = violation.getConstraintDescriptor().getAnnotation().annotationType().getSimpleName();
        return new ValidationFailure(propertyPath.isEmpty() ? ValidationFailure.ROOT : ValidationFailure.ROOT + "." + propertyPath,
                                     CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, rule),
                                     violation.getMessage());
    }

    private static String toPath(List<JsonMappingException.Reference> references) {
        final var path = new StringBuilder(ValidationFailure.ROOT);
        for (final var reference : references) {
            if (reference.getFieldName() != null) {
                path.append('.').append(reference.getFieldName());
            }
            else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.toString();
    }

    static String jsonType(Class<?> type) {
        if (type == null) {
            return "value";
        }
        final var wrapped = Primitives.wrap(type);
        if (wrapped == Integer.class || wrapped == Long.class || wrapped == Short.class || wrapped == Byte.class
                || wrapped == BigInteger.class) {
            return "integer";
        }
        if (Number.class.isAssignableFrom(wrapped)) {
            return "number";
        }
        if (wrapped == Boolean.class) {
            return "boolean";
        }
        if (CharSequence.class.isAssignableFrom(wrapped) || wrapped == Character.class || wrapped.isEnum()) {
            return "string";
        }
        if (Collection.class.isAssignableFrom(wrapped) || wrapped.isArray()) {
            return "array";
        }
        return "object";
    }
}
