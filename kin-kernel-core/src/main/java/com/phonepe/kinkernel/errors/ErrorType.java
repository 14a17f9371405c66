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

package com.phonepe.kinkernel.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome types for a cell execution
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", Category.NONE),
    INPUT_VALIDATION_FAILURE("Input validation failed. Errors: %s", Category.VALIDATION),
    OUTPUT_VALIDATION_FAILURE("Output validation failed. Errors: %s", Category.VALIDATION),
    EXECUTION_FAILURE("Cell execution failed with error: %s", Category.EXECUTION),
    EXECUTION_CANCELLED("Cell execution was cancelled", Category.EXECUTION),
    EXECUTION_TIMEOUT("Cell execution timed out after %s", Category.EXECUTION),
    ;

    /**
     * Separates "the data has the wrong shape" from "the business logic did not complete"
     */
    public enum Category {
        NONE,
        VALIDATION,
        EXECUTION,
    }

    private final String message;
    private final Category category;
}
