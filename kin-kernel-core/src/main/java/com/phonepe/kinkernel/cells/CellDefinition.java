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

package com.phonepe.kinkernel.cells;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.kinkernel.config.EnvVar;
import com.phonepe.kinkernel.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Static description of a cell type: what it is, what it consumes and produces, and which environment variables it
 * needs. Kept separate from the cell so the same definition can be inspected without constructing a cell (and
 * without resolving its configuration).
 *
 * @param <I> Input type
 * @param <O> Output type
 */
@Value
@Builder
@With
public class CellDefinition<I, O> {
    /**
     * Short classification of what the cell does, for example "Processor"
     */
    @NonNull
    String role;

    /**
     * Human-readable description of the cell
     */
    @NonNull
    String description;

    @NonNull
    Class<I> inputType;

    @NonNull
    Class<O> outputType;

    /**
     * Environment variables resolved when the cell is constructed. Empty if the cell needs no configuration.
     */
    @Singular
    List<EnvVar> envVars;

    public static <I, O> CellDefinitionBuilder<I, O> builder(Class<I> inputType, Class<O> outputType) {
        return new CellDefinitionBuilder<I, O>()
                .inputType(inputType)
                .outputType(outputType);
    }

    public JsonNode inputSchema() {
        return JsonUtils.schema(inputType);
    }

    public JsonNode outputSchema() {
        return JsonUtils.schema(outputType);
    }
}
