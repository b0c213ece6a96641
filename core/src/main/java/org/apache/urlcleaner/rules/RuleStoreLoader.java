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
package org.apache.urlcleaner.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.urlcleaner.JSONResource;
import org.apache.urlcleaner.util.ConfUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the domain configurations from a JSON rules file and builds a {@link RuleStore} from them.
 * The file is looked for on the file system first, then on the classpath.
 */
public class RuleStoreLoader implements JSONResource {

    private static final Logger LOG = LoggerFactory.getLogger(RuleStoreLoader.class);

    public static final String RULES_FILE_PARAM = "urlcleaner.rules.file";

    public static final String DEFAULT_RULES_FILE = "default-rules.json";

    private static final TypeReference<LinkedHashMap<String, DomainConfig>> CONFIG_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    private final String resourceFile;

    private Map<String, DomainConfig> config = new LinkedHashMap<>();

    public RuleStoreLoader(@NotNull String resourceFile) {
        this.resourceFile = resourceFile;
    }

    @Override
    public String getResourceFile() {
        return resourceFile;
    }

    @Override
    public void loadJSONResources(InputStream inputStream) throws IOException {
        Map<String, DomainConfig> read = mapper.readValue(inputStream, CONFIG_TYPE);
        config = read == null ? new LinkedHashMap<>() : read;
    }

    /** Domain configurations read by the last call to {@link #loadJSONResources()}. */
    public Map<String, DomainConfig> getConfig() {
        return config;
    }

    /**
     * Loads the rules file and builds the store.
     *
     * @throws RuleConfigurationException if the file can't be read or holds an invalid rule
     */
    @NotNull
    public static RuleStore load(@NotNull String resourceFile) {
        RuleStoreLoader loader = new RuleStoreLoader(resourceFile);
        try {
            loader.loadJSONResources();
        } catch (IOException e) {
            String message = "Exception caught while loading the rules from " + resourceFile;
            LOG.error(message);
            throw new RuleConfigurationException(message, e);
        }
        LOG.info("Loaded {} rule entries from {}", loader.config.size(), resourceFile);
        return RuleStore.build(loader.config);
    }

    /** Loads the rules file named by {@value #RULES_FILE_PARAM}. */
    @NotNull
    public static RuleStore fromConf(@NotNull Map<String, Object> conf) {
        return load(ConfUtils.getString(conf, RULES_FILE_PARAM, DEFAULT_RULES_FILE));
    }
}
