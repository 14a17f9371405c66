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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Joiner;
import com.phonepe.kinkernel.schema.ValidationFailure;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Error from cell execution. Validation errors carry the individual failures, execution errors carry the
 * underlying cause.
 */
@Value
public class CellError {
    @NonNull
    ErrorType errorType;
    String message;
    List<ValidationFailure> failures;
    @JsonIgnore
    Throwable cause;

    public static CellError success() {
        return new CellError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage(), List.of(), null);
    }

    public static CellError validation(ErrorType errorType, List<ValidationFailure> failures) {
        final var failureList = List.copyOf(failures);
        return new CellError(errorType,
                             String.format(errorType.getMessage(), Joiner.on("; ").join(failureList)),
                             failureList,
                             null);
    }

    public static CellError execution(ErrorType errorType, Throwable throwable, Object... args) {
        return new CellError(errorType, String.format(errorType.getMessage(), args), List.of(), throwable);
    }

    public static CellError error(ErrorType errorType, Throwable throwable) {
        var cause = throwable.getCause();
        var message = throwable.getMessage();
        do {
            if (cause != null) {
                message = cause.getMessage();
                cause = cause.getCause();
            }
        } while (cause != null);
        return CellError.execution(errorType, throwable, message);
    }

    @JsonIgnore
    public boolean isValidationError() {
        return errorType.getCategory() == ErrorType.Category.VALIDATION;
    }

    @JsonIgnore
    public boolean isExecutionError() {
        return errorType.getCategory() == ErrorType.Category.EXECUTION;
    }
}
