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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Either a parsed and validated value, or the failures that prevented parsing
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParseResult<T> {
    T value;
    List<ValidationFailure> failures;

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(value, List.of());
    }

    public static <T> ParseResult<T> failure(List<ValidationFailure> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("A failed parse result needs at least one failure");
        }
        return new ParseResult<>(null, List.copyOf(failures));
    }

    public static <T> ParseResult<T> failure(ValidationFailure failure) {
        return failure(List.of(failure));
    }
}
