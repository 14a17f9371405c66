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

package com.phonepe.kinkernel.config;

import com.phonepe.kinkernel.utils.EnvLoader;

import java.util.Map;
import java.util.Optional;

/**
 * Source of environment variable values. The process environment is used unless a cell is set up with
 * something else.
 */
@FunctionalInterface
public interface EnvSource {
    Optional<String> read(String key);

    static EnvSource system() {
        return EnvLoader::readEnv;
    }

    static EnvSource of(Map<String, String> values) {
        final var copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }
}
