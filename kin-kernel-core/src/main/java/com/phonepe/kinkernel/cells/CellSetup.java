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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.phonepe.kinkernel.config.EnvSource;
import com.phonepe.kinkernel.utils.JsonUtils;
import com.phonepe.kinkernel.utils.ValidationUtils;
import jakarta.validation.Validator;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runtime collaborators of a cell. Kept out of {@link CellDefinition} so that one setup can be shared by many cells.
 * Anything not provided is defaulted.
 */
@Value
@Builder
@With
public class CellSetup {
    /**
     * Mapper used on the validation boundaries. Defaults to {@link JsonUtils#createMapper()}. A custom mapper should
     * keep creator properties required, otherwise missing fields are not reported.
     */
    ObjectMapper mapper;

    /**
     * Constraint validator. Defaults to {@link ValidationUtils#createValidator()}.
     */
    Validator validator;

    /**
     * Executor the business logic is started on. Defaults to a cached pool of daemon threads.
     */
    ExecutorService executorService;

    /**
     * Where environment variables are read from. Defaults to the process environment.
     */
    EnvSource envSource;

    public CellSetup(
            ObjectMapper mapper,
            Validator validator,
            ExecutorService executorService,
            EnvSource envSource) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.validator = Objects.requireNonNullElseGet(validator, ValidationUtils::createValidator);
        this.executorService = Objects.requireNonNullElseGet(executorService, CellSetup::defaultExecutor);
        this.envSource = Objects.requireNonNullElseGet(envSource, EnvSource::system);
    }

    private static ExecutorService defaultExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                     .setDaemon(true)
                                                     .setNameFormat("cell-executor-%d")
                                                     .build());
    }
}
