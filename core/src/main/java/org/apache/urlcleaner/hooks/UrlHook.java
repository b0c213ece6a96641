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
package org.apache.urlcleaner.hooks;

import okhttp3.HttpUrl;
import org.apache.urlcleaner.util.AbstractConfigurable;
import org.jetbrains.annotations.NotNull;

/**
 * Transformation applied to a URL once its query has been cleaned. Rules name the hooks to apply
 * and the {@link HookRegistry} maps these names to instances.
 *
 * <p>Implementations must be deterministic and free of side effects; a single instance is shared
 * by all the threads cleaning URLs. Configuration happens once, through {@link
 * #configure(java.util.Map, com.fasterxml.jackson.databind.JsonNode)}, before the instance is
 * registered.
 */
public abstract class UrlHook extends AbstractConfigurable {

    protected UrlHook() {}

    protected UrlHook(String name) {
        super(name);
    }

    /**
     * Returns the transformed URL.
     *
     * @throws HookException if the URL is not one this hook can handle
     */
    @NotNull
    public abstract HttpUrl apply(@NotNull HttpUrl url) throws HookException;
}
