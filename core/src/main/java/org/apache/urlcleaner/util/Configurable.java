/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.urlcleaner.util;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;

/**
 * An interface marking the implementing class as initializeable and configurable via {@link
 * Configurable#createConfiguredInstance(String, Class, Map, JsonNode)}. The implementing class
 * <b>HAS</b> to implement an empty constructor.
 */
public interface Configurable {

    String getName();

    /**
     * Called when this instance is being initialized
     *
     * @param conf The engine configuration
     * @param params the instance specific configuration. Never null
     */
    default void configure(@NotNull Map<String, Object> conf, @NotNull JsonNode params) {}

    /**
     * Called when this instance is being initialized
     *
     * @param conf The engine configuration
     * @param params the instance specific configuration. Never null
     * @param name The name the instance is declared under.
     */
    default void configure(
            @NotNull Map<String, Object> conf, @NotNull JsonNode params, @NotNull String name) {}

    /**
     * Searches for a child node in {@code jsonConf} with the given {@code configName} and
     * initializes every element of the list it holds as {@code clazz}.
     *
     * <pre>{@code
     * {
     *   <configName>: [
     *     {
     *       "name": "<unnamed>",
     *       "class": "fully.qualified.ClassName",
     *       "params": { ... }
     *     }
     *   ]
     * }
     * }</pre>
     */
    @NotNull
    static <T extends Configurable> List<@NotNull T> createConfiguredInstance(
            @NotNull String configName,
            @NotNull Class<T> clazz,
            @NotNull Map<String, Object> conf,
            @NotNull JsonNode jsonConf) {
        return ConfigurableHelper.createConfiguredInstance(configName, clazz, conf, jsonConf);
    }
}
