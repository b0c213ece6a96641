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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang.StringUtils;
import org.apache.urlcleaner.JSONResource;
import org.apache.urlcleaner.util.ConfUtils;
import org.apache.urlcleaner.util.Configurable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from hook name to {@link UrlHook}. The built-in hooks are {@value
 * VideoIdDecodeHook#NAME} and {@value DomainMirrorHook#NAME}; more can be declared in the JSON file
 * named by {@value #HOOKS_FILE_PARAM}:
 *
 * <pre>{@code
 * {
 *   "hooks": [
 *     {
 *       "name": "nitter",
 *       "class": "org.apache.urlcleaner.hooks.DomainMirrorHook",
 *       "params": { "mirrors": { "twitter.com": "nitter.net" } }
 *     }
 *   ]
 * }
 * }</pre>
 *
 * A declared hook replaces a built-in one of the same name.
 */
public final class HookRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(HookRegistry.class);

    public static final String HOOKS_FILE_PARAM = "urlcleaner.hooks.file";

    /** Name of the list of hooks in the JSON file. */
    public static final String HOOKS_CONFIG_NAME = "hooks";

    public static final HookRegistry EMPTY = new HookRegistry(Map.of());

    private final Map<String, UrlHook> hooks;

    private HookRegistry(Map<String, UrlHook> hooks) {
        this.hooks = Map.copyOf(hooks);
    }

    /** Registry holding the built-in hooks with their default configuration. */
    @NotNull
    public static HookRegistry builtin() {
        return builder().withBuiltins().build();
    }

    /**
     * Registry holding the built-in hooks and the ones declared in the file named by {@value
     * #HOOKS_FILE_PARAM}, if any.
     *
     * @throws RuntimeException if the file can not be read or a declared hook can not be set up
     */
    @NotNull
    public static HookRegistry fromConf(@NotNull Map<String, Object> conf) {
        Builder builder = builder().withBuiltins();
        String hooksFile = ConfUtils.getString(conf, HOOKS_FILE_PARAM);
        if (StringUtils.isNotBlank(hooksFile)) {
            HookLoader loader = new HookLoader(conf, hooksFile);
            try {
                loader.loadJSONResources();
            } catch (IOException e) {
                String message = "Exception caught while loading the hooks from " + hooksFile;
                LOG.error(message);
                throw new RuntimeException(message, e);
            }
            for (UrlHook hook : loader.hooks) {
                builder.register(hook.getName(), hook);
            }
        }
        HookRegistry registry = builder.build();
        LOG.info("Hooks available: {}", registry.names());
        return registry;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the hook registered under this name, null if there is none. */
    @Nullable
    public UrlHook get(@NotNull String name) {
        return hooks.get(name);
    }

    public boolean contains(@NotNull String name) {
        return hooks.containsKey(name);
    }

    public Set<String> names() {
        return hooks.keySet();
    }

    public static final class Builder {

        private final Map<String, UrlHook> hooks = new LinkedHashMap<>();

        private Builder() {}

        public Builder withBuiltins() {
            register(VideoIdDecodeHook.NAME, new VideoIdDecodeHook());
            register(DomainMirrorHook.NAME, new DomainMirrorHook());
            return this;
        }

        public Builder register(@NotNull String name, @NotNull UrlHook hook) {
            if (StringUtils.isBlank(name)) {
                throw new IllegalArgumentException("Hook name is blank for " + hook);
            }
            if (hooks.put(name, hook) != null) {
                LOG.info("Hook {} replaced by {}", name, hook.getClass().getName());
            }
            return this;
        }

        public HookRegistry build() {
            return new HookRegistry(hooks);
        }
    }

    /** Instantiates the hooks declared in a JSON file. */
    private static class HookLoader implements JSONResource {

        private final Map<String, Object> conf;

        private final String resourceFile;

        private List<UrlHook> hooks = List.of();

        HookLoader(Map<String, Object> conf, String resourceFile) {
            this.conf = conf;
            this.resourceFile = resourceFile;
        }

        @Override
        public String getResourceFile() {
            return resourceFile;
        }

        @Override
        public void loadJSONResources(InputStream inputStream) throws IOException {
            JsonNode confNode = new ObjectMapper().readTree(inputStream);
            if (confNode == null) {
                return;
            }
            hooks =
                    Configurable.createConfiguredInstance(
                            HOOKS_CONFIG_NAME, UrlHook.class, conf, confNode);
        }
    }
}
