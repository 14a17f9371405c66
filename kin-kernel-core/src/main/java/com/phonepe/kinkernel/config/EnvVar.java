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

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Declaration of an environment variable used by a cell. A variable without a default value is required.
 */
@Value
public class EnvVar {
    /**
     * Name of the variable in the environment
     */
    String key;

    /**
     * Default value, used when the environment does not have the variable. Null for required variables.
     */
    String value;

    public EnvVar(String key, String value) {
        Preconditions.checkArgument(key != null && !key.isBlank(),
                                    "Please provide a valid environment variable name");
        this.key = key;
        this.value = value;
    }

    public static EnvVar required(String key) {
        return new EnvVar(key, null);
    }

    public static EnvVar withDefault(String key, String defaultValue) {
        Preconditions.checkArgument(defaultValue != null, "Default value for %s cannot be null", key);
        return new EnvVar(key, defaultValue);
    }

    public boolean isRequired() {
        return value == null;
    }
}
