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
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.urlcleaner.util.exceptions.InitialisationException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ConfigurableHelper {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigurableHelper.class);

    private ConfigurableHelper() {}

    /** @see Configurable#createConfiguredInstance(String, Class, Map, JsonNode) */
    @NotNull
    static <T extends Configurable> List<@NotNull T> createConfiguredInstance(
            @NotNull String configName,
            @NotNull Class<T> clazz,
            @NotNull Map<String, Object> conf,
            @NotNull JsonNode jsonConf) {
        List<T> instances = new ArrayList<>();

        JsonNode listNode = jsonConf.get(configName);
        if (listNode == null) {
            LOG.info("No field {} in JSON config. Skipping...", configName);
            return instances;
        }

        Iterator<JsonNode> iter = listNode.elements();
        while (iter.hasNext()) {
            JsonNode instanceConf = iter.next();
            String instanceName = "<unnamed>";
            JsonNode nameNode = instanceConf.get("name");
            if (nameNode != null) {
                instanceName = nameNode.textValue();
            }
            JsonNode classNode = instanceConf.get("class");
            if (classNode == null) {
                LOG.error("{} doesn't specify a 'class' attribute", instanceName);
                continue;
            }
            String className = classNode.textValue().trim();
            try {
                T instance = InitialisationUtil.initializeFromQualifiedName(className, clazz);

                JsonNode paramNode = instanceConf.get("params");
                if (paramNode != null) {
                    instance.configure(conf, paramNode, instanceName);
                } else {
                    // Pass in a nullNode if missing
                    instance.configure(conf, NullNode.getInstance(), instanceName);
                }

                instances.add(instance);
                LOG.info("Setup {}[{}]", instanceName, className);
            } catch (Exception e) {
                LOG.error("Can't setup {}[{}]: {}", instanceName, className, e.toString());
                throw new InitialisationException(
                        "Can't setup " + instanceName + '[' + className + ']', e);
            }
        }

        return instances;
    }
}
