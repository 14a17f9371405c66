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

import lombok.NonNull;
import lombok.Value;

/**
 * A single schema violation. The path is JSONPath-like: {@code $} for the document itself,
 * {@code $.items[0].id} for nested members.
 */
@Value
public class ValidationFailure {
    public static final String ROOT = "$";

    @NonNull
    String path;

    /**
     * Name of the violated rule, for example {@code type}, {@code required} or {@code min}
     */
    @NonNull
    String rule;

    @NonNull
    String message;

    public static ValidationFailure root(String rule, String message) {
        return new ValidationFailure(ROOT, rule, message);
    }

    @Override
    public String toString() {
        return "%s: %s [%s]".formatted(path, message, rule);
    }
}
