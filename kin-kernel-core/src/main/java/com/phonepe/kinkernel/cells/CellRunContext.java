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

import com.phonepe.kinkernel.config.ConfigModel;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Context passed to the business logic of a cell. This remains constant for a particular run.
 */
@Value
public class CellRunContext {
    /**
     * An id for this particular run. This is used to track the run in logs
     */
    String runId;

    /**
     * Role of the cell being run
     */
    String role;

    @Getter(AccessLevel.NONE)
    ConfigModel config;

    @Getter(AccessLevel.NONE)
    BooleanSupplier cancellationSignal;

    /**
     * Resolved configuration of the cell, empty if the cell does not declare any environment variables
     */
    public Optional<ConfigModel> getConfig() {
        return Optional.ofNullable(config);
    }

    /**
     * Whether the caller has cancelled this run or its timeout has expired. Long running or blocking logic should
     * check this and stop early.
     */
    public boolean isCancelled() {
        return cancellationSignal.getAsBoolean();
    }
}
