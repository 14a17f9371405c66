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
import com.phonepe.kinkernel.errors.ConfigResolutionError;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration of a cell, resolved from the environment exactly once, when the model is constructed.
 * For every declared {@link EnvVar} the environment value wins over the declared default. Construction fails
 * with a {@link ConfigResolutionError} naming every required variable that had no value.
 * Resolved values never change afterwards.
 */
@Slf4j
public class ConfigModel {
    @Getter
    private final List<EnvVar> envVars;
    private final Map<String, String> values;

    public ConfigModel(List<EnvVar> envVars) {
        this(envVars, EnvSource.system());
    }

    public ConfigModel(@NonNull List<EnvVar> envVars, @NonNull EnvSource envSource) {
        final var seen = new HashSet<String>();
        envVars.forEach(envVar -> Preconditions.checkArgument(seen.add(envVar.getKey()),
                                                              "Environment variable %s is declared more than once",
                                                              envVar.getKey()));
        this.envVars = List.copyOf(envVars);
        final var resolved = new LinkedHashMap<String, String>();
        final var missing = new ArrayList<String>();
        for (final var envVar : this.envVars) {
            final var fromEnv = envSource.read(envVar.getKey());
            if (fromEnv.isPresent()) {
                resolved.put(envVar.getKey(), fromEnv.get());
            }
            else if (!envVar.isRequired()) {
                log.debug("Using default value for environment variable {}", envVar.getKey());
                resolved.put(envVar.getKey(), envVar.getValue());
            }
            else {
                missing.add(envVar.getKey());
            }
        }
        if (!missing.isEmpty()) {
            log.error("Missing required environment variables: {}", missing);
            throw new ConfigResolutionError(missing);
        }
        this.values = Collections.unmodifiableMap(resolved);
    }

    public static ConfigModel of(EnvVar... envVars) {
        return new ConfigModel(List.of(envVars));
    }

    /**
     * Resolved value of a declared variable
     *
     * @param key Variable name
     * @return The value
     * @throws IllegalArgumentException if the variable was not declared
     */
    public String get(String key) {
        Preconditions.checkArgument(values.containsKey(key), "Environment variable %s has not been declared", key);
        return values.get(key);
    }

    public <T> T get(String key, Function<String, T> converter) {
        return converter.apply(get(key));
    }

    /**
     * @return All resolved values in declaration order
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ConfigModel" + values.keySet();
    }
}
