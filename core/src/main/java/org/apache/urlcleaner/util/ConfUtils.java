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

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;

public class ConfUtils {

    /** Classpath resource holding the default values of the configuration. */
    public static final String DEFAULT_CONFIG_FILE = "urlcleaner-default.yaml";

    private ConfUtils() {}

    public static int getInt(
            @NotNull Map<String, Object> conf, @NotNull String key, int defaultValue) {
        Object ret = conf.get(key);
        if (ret == null) {
            ret = defaultValue;
        }
        return ((Number) ret).intValue();
    }

    public static boolean getBoolean(
            @NotNull Map<String, Object> conf, @NotNull String key, boolean defaultValue) {
        Object ret = conf.get(key);
        if (ret == null) {
            ret = defaultValue;
        }
        if (ret instanceof String) {
            return Boolean.parseBoolean((String) ret);
        }
        return (Boolean) ret;
    }

    @Nullable
    public static String getString(@NotNull Map<String, Object> conf, @NotNull String key) {
        return (String) conf.get(key);
    }

    public static String getString(
            @NotNull Map<String, Object> conf, @NotNull String key, @Nullable String defaultValue) {
        Object ret = conf.get(key);
        if (ret == null) {
            ret = defaultValue;
        }
        return (String) ret;
    }

    /** Loads the defaults from {@value #DEFAULT_CONFIG_FILE} on the classpath. */
    @NotNull
    public static Map<String, Object> loadDefaultConf() {
        Map<String, Object> conf = new HashMap<>();
        InputStream in = ConfUtils.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE);
        if (in == null) {
            return conf;
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            conf.putAll(readYaml(reader));
        } catch (IOException e) {
            throw new RuntimeException("Can't read " + DEFAULT_CONFIG_FILE, e);
        }
        return conf;
    }

    /**
     * Loads the YAML file at {@code resource} on top of the defaults.
     *
     * @throws FileNotFoundException if there is no such file
     */
    @NotNull
    public static Map<String, Object> loadConf(@NotNull String resource)
            throws FileNotFoundException {
        Map<String, Object> conf = loadDefaultConf();
        try (Reader reader =
                new InputStreamReader(new FileInputStream(resource), StandardCharsets.UTF_8)) {
            conf.putAll(readYaml(reader));
        } catch (FileNotFoundException e) {
            throw e;
        } catch (IOException e) {
            throw new RuntimeException("Can't read " + resource, e);
        }
        return conf;
    }

    private static Map<String, Object> readYaml(Reader reader) {
        Map<String, Object> ret = new Yaml().load(reader);
        if (ret == null) {
            return new HashMap<>();
        }
        return extractConfigElement(ret);
    }

    /** If the config consists of a single key 'config', its values are used instead */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> extractConfigElement(Map<String, Object> conf) {
        if (conf.size() == 1) {
            Object confNode = conf.get("config");
            if (confNode instanceof Map) {
                conf = (Map<String, Object>) confNode;
            }
        }
        return conf;
    }
}
