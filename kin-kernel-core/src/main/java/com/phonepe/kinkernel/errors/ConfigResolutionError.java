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

import lombok.Getter;

import java.util.List;

/**
 * Required environment variables could not be resolved while constructing a cell configuration.
 * Lists every missing key, not just the first one found.
 */
@Getter
public class ConfigResolutionError extends RuntimeException {
    private final List<String> missingKeys;

    public ConfigResolutionError(final List<String> missingKeys) {
        super("Please set environment variable(s): %s".formatted(String.join(", ", missingKeys)));
        this.missingKeys = List.copyOf(missingKeys);
    }
}
