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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.CaseFormat;
import com.google.common.base.Splitter;
import com.phonepe.kinkernel.cells.Cell;
import com.phonepe.kinkernel.cells.CellOutput;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Exposes a {@link Cell} as a function that can be offered to an LLM for function/tool calling. The function
 * name is derived from the role of the cell, the parameters from its input schema.
 *
 * @param <O> Output type of the wrapped cell
 */
@Slf4j
public class FunctionCell<O> {
    @Getter
    private final Cell<?, O> cell;
    @Getter
    private final String name;
    @Getter
    private final String description;

    public FunctionCell(@NonNull Cell<?, O> cell) {
        this.cell = cell;
        this.name = functionName(cell.getRole());
        this.description = cell.getDescription();
    }

    public static <O> FunctionCell<O> of(Cell<?, O> cell) {
        return new FunctionCell<>(cell);
    }

    public static List<FunctionCell<?>> from(@NonNull List<? extends Cell<?, ?>> cells) {
        return cells.stream()
                .<FunctionCell<?>>map(FunctionCell::of)
                .toList();
    }

    /**
     * @return Input schema of the cell in function calling form: {@code {properties, required, type}}
     */
    public ObjectNode parameters() {
        try {
            return SchemaRefInliner.parameters(SchemaRefInliner.inline(cell.getInputSchema()));
        }
        catch (SchemaDefinitionException e) {
            throw new SchemaDefinitionException("No usable input schema found in the cell %s: %s"
                                                        .formatted(cell.getRole(), e.getMessage()));
        }
    }

    /**
     * @return {@code {name, description, parameters}} for this function
     */
    public ObjectNode definition() {
        final var definition = JsonNodeFactory.instance.objectNode();
        definition.put("name", name);
        definition.put("description", description);
        definition.set("parameters", parameters());
        return definition;
    }

    /**
     * Run the cell with arguments received from a function call
     *
     * @param arguments Function arguments, usually JSON text
     * @return Future with the validated output of the cell. Fails with a
     * {@link com.phonepe.kinkernel.errors.CellException} if the cell run failed.
     */
    public CompletableFuture<O> invokeAsync(final Object arguments) {
        log.debug("Function {} called", name);
        return cell.executeAsync(arguments).thenApply(CellOutput::orThrow);
    }

    @Override
    public String toString() {
        return name + "()";
    }

    static String functionName(String role) {
        final var camel = Splitter.onPattern("[^A-Za-z0-9]+")
                .omitEmptyStrings()
                .splitToStream(role)
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining());
        return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, camel);
    }
}
