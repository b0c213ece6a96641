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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DomainMirrorHookTest {

    private static DomainMirrorHook createHook(Map<String, String> mirrors) {
        ObjectNode params = new ObjectNode(JsonNodeFactory.instance);
        ObjectNode table = params.putObject("mirrors");
        mirrors.forEach(table::put);
        DomainMirrorHook hook = new DomainMirrorHook();
        hook.configure(new HashMap<>(), params);
        return hook;
    }

    @Test
    void testDefaultMirrors() throws HookException {
        DomainMirrorHook hook = new DomainMirrorHook();
        HttpUrl mirrored = hook.apply(HttpUrl.get("https://twitter.com/user/status/1?lang=en#top"));
        Assertions.assertEquals(
                "https://nitter.net/user/status/1?lang=en#top", mirrored.toString());

        mirrored = hook.apply(HttpUrl.get("https://www.youtube.com/watch?v=abc"));
        Assertions.assertEquals("https://piped.video/watch?v=abc", mirrored.toString());
    }

    @Test
    void testUnknownDomain() {
        DomainMirrorHook hook = new DomainMirrorHook();
        HookException e =
                Assertions.assertThrows(
                        HookException.class,
                        () -> hook.apply(HttpUrl.get("https://example.com/page")));
        Assertions.assertEquals("no mirror for domain example.com", e.getMessage());
    }

    @Test
    void testConfiguredMirrors() throws HookException {
        DomainMirrorHook hook = createHook(Map.of("Tweets.Example", "mirror.example"));
        Assertions.assertEquals(Map.of("tweets.example", "mirror.example"), hook.getMirrors());
        Assertions.assertEquals(
                "http://mirror.example:8080/a/b?c=d",
                hook.apply(HttpUrl.get("http://tweets.example:8080/a/b?c=d")).toString());
        // the configured table replaces the default one
        Assertions.assertThrows(
                HookException.class, () -> hook.apply(HttpUrl.get("https://twitter.com/")));
    }

    @Test
    void testParamsWithoutMirrors() {
        DomainMirrorHook hook = new DomainMirrorHook();
        hook.configure(new HashMap<>(), new ObjectNode(JsonNodeFactory.instance));
        Assertions.assertEquals(DomainMirrorHook.DEFAULT_MIRRORS, hook.getMirrors());
    }

    @Test
    void testInvalidMirror() {
        DomainMirrorHook hook = createHook(Map.of("tweets.example", "not a host"));
        Assertions.assertThrows(
                HookException.class, () -> hook.apply(HttpUrl.get("https://tweets.example/")));
    }
}
