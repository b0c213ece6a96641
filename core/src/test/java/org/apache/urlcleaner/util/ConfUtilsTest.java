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

import java.io.File;
import java.io.FileNotFoundException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConfUtilsTest {

    @Test
    void testDefaultConf() {
        Map<String, Object> conf = ConfUtils.loadDefaultConf();
        Assertions.assertEquals(
                "default-rules.json", ConfUtils.getString(conf, "urlcleaner.rules.file"));
        Assertions.assertNull(ConfUtils.getString(conf, "urlcleaner.hooks.file"));
        Assertions.assertEquals("urlcleaner", ConfUtils.getString(conf, "http.agent"));
        Assertions.assertEquals(10000, ConfUtils.getInt(conf, "http.timeout", -1));
        Assertions.assertEquals(30000, ConfUtils.getInt(conf, "http.call.timeout", -1));
        Assertions.assertEquals(10, ConfUtils.getInt(conf, "http.max.redirects", -1));
        Assertions.assertTrue(ConfUtils.getBoolean(conf, "http.method.head", false));
    }

    @Test
    void testLoadConfOverridesDefaults() throws Exception {
        File file = new File(getClass().getClassLoader().getResource("test-conf.yaml").toURI());
        Map<String, Object> conf = ConfUtils.loadConf(file.getAbsolutePath());

        Assertions.assertEquals(
                "test-rules.json", ConfUtils.getString(conf, "urlcleaner.rules.file"));
        Assertions.assertEquals(
                "test-hooks.json", ConfUtils.getString(conf, "urlcleaner.hooks.file"));
        Assertions.assertEquals(3, ConfUtils.getInt(conf, "http.max.redirects", -1));
        Assertions.assertFalse(ConfUtils.getBoolean(conf, "http.method.head", true));
        // not overridden
        Assertions.assertEquals(10000, ConfUtils.getInt(conf, "http.timeout", -1));
    }

    @Test
    void testLoadMissingConf() {
        Assertions.assertThrows(
                FileNotFoundException.class, () -> ConfUtils.loadConf("does/not/exist.yaml"));
    }

    @Test
    void testGetters() {
        Map<String, Object> conf = new HashMap<>();
        conf.put("bool.string", "false");
        conf.put("string", "value");
        Assertions.assertFalse(ConfUtils.getBoolean(conf, "bool.string", true));
        Assertions.assertTrue(ConfUtils.getBoolean(conf, "missing", true));
        Assertions.assertEquals(5, ConfUtils.getInt(conf, "missing", 5));
        Assertions.assertEquals("value", ConfUtils.getString(conf, "string", "other"));
        Assertions.assertEquals("other", ConfUtils.getString(conf, "missing", "other"));
    }

    @Test
    void testExtractConfigElement() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("http.timeout", 100);
        Map<String, Object> wrapped = new HashMap<>();
        wrapped.put("config", inner);
        Assertions.assertSame(inner, ConfUtils.extractConfigElement(wrapped));

        Map<String, Object> flat = new HashMap<>();
        flat.put("http.timeout", 100);
        Assertions.assertSame(flat, ConfUtils.extractConfigElement(flat));
    }
}
