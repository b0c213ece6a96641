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
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces the host of a URL with a privacy friendly mirror. Only the host changes, path, query
 * and fragment are left as they are. URLs whose host has no mirror are rejected.
 *
 * <p>The table can be replaced with the <code>mirrors</code> parameter:
 *
 * <pre>{@code
 * "params": {
 *   "mirrors": {
 *     "twitter.com": "nitter.net"
 *   }
 * }
 * }</pre>
 */
public class DomainMirrorHook extends UrlHook {

    private static final Logger LOG = LoggerFactory.getLogger(DomainMirrorHook.class);

    public static final String NAME = "domain-mirror";

    static final Map<String, String> DEFAULT_MIRRORS =
            Map.of(
                    "twitter.com", "nitter.net",
                    "www.twitter.com", "nitter.net",
                    "mobile.twitter.com", "nitter.net",
                    "x.com", "nitter.net",
                    "www.youtube.com", "piped.video",
                    "youtube.com", "piped.video",
                    "m.youtube.com", "piped.video",
                    "www.reddit.com", "safereddit.com",
                    "reddit.com", "safereddit.com");

    private Map<String, String> mirrors = DEFAULT_MIRRORS;

    public DomainMirrorHook() {
        super(NAME);
    }

    @Override
    public void configure(@NotNull Map<String, Object> conf, @NotNull JsonNode params) {
        JsonNode node = params.get("mirrors");
        if (node == null) {
            return;
        }
        if (!node.isObject()) {
            LOG.warn("Failed to configure mirrors. Not an object: {}", node);
            return;
        }
        Map<String, String> table = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            table.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().asText());
        }
        mirrors = Map.copyOf(table);
        LOG.info("{} configured with {} mirrors", getName(), mirrors.size());
    }

    @Override
    public @NotNull HttpUrl apply(@NotNull HttpUrl url) throws HookException {
        String mirror = mirrors.get(url.host());
        if (mirror == null) {
            throw new HookException("no mirror for domain " + url.host());
        }
        try {
            return url.newBuilder().host(mirror).build();
        } catch (IllegalArgumentException e) {
            throw new HookException("invalid mirror '" + mirror + "' for domain " + url.host());
        }
    }

    public Map<String, String> getMirrors() {
        return mirrors;
    }
}
