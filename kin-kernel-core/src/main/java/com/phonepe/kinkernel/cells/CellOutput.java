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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.kinkernel.errors.CellError;
import com.phonepe.kinkernel.errors.CellException;
import com.phonepe.kinkernel.errors.ErrorType;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of a cell execution. Either validated output data, or an error.
 */
@Value
public class CellOutput<O> {
    String runId;
    O data;
    @NonNull
    CellError error;

    public static <O> CellOutput<O> success(String runId, O data) {
        return new CellOutput<>(runId, data, CellError.success());
    }

    public static <O> CellOutput<O> error(String runId, CellError error) {
        return new CellOutput<>(runId, null, error);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error.getErrorType() == ErrorType.SUCCESS;
    }

    /**
     * @return The output data
     * @throws CellException if the execution failed
     */
    public O orThrow() {
        if (!isSuccessful()) {
            throw new CellException(error);
        }
        return data;
    }
}
