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
import java.util.Map;
import org.jetbrains.annotations.NotNull;

/** Keeps the name an instance has been declared under. */
public abstract class AbstractConfigurable implements Configurable {

    private String name;

    protected AbstractConfigurable() {}

    protected AbstractConfigurable(String name) {
        this.name = name;
    }

    @Override
    public void configure(
            @NotNull Map<String, Object> conf,
            @NotNull JsonNode params,
            @NotNull String configName) {
        this.name = configName;
        configure(conf, params);
    }

    /**
     * Get the declared name.
     *
     * @return a {@link String}.
     */
    @Override
    public String getName() {
        return this.name;
    }
}
