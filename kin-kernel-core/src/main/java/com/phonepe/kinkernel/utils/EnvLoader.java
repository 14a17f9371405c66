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

package com.phonepe.kinkernel.utils;

import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Reads an environment variable
     * @param variable the name of the variable
     * @return the value of the variable, empty if it is not set
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(System.getenv(variable));
    }

    /**
     * Reads an environment variable, falling back to a default
     * @param variable the name of the variable
     * @param defaultValue value to return if the variable is not set
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(variable).orElse(defaultValue);
    }
}
