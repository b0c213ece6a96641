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
package org.apache.urlcleaner.filtering;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import okhttp3.HttpUrl;
import org.apache.urlcleaner.CleanException;
import org.apache.urlcleaner.CleanException.Reason;
import org.apache.urlcleaner.rules.Rule;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class QueryFilterTest {

    private static Rule rule(List<String> hooks, String... denylist) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : denylist) {
            patterns.add(Pattern.compile(regex));
        }
        return new Rule(false, patterns, hooks);
    }

    private static Rule rule(String... denylist) {
        return rule(List.of(), denylist);
    }

    private static String filter(String url, Rule rule) throws CleanException {
        return QueryFilter.filter(HttpUrl.get(url), rule).toString();
    }

    private static Reason failure(String url, Rule rule) {
        return Assertions.assertThrows(
                        CleanException.class, () -> QueryFilter.filter(HttpUrl.get(url), rule))
                .getReason();
    }

    @Test
    void testRemoveOnlyParameter() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/",
                filter("https://example.com/?utm_source=ios", rule("^utm_")));
    }

    @Test
    void testRemoveSomeOfManyParameters() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/path?keep1=true&keep2=true",
                filter(
                        "https://example.com/path?keep1=true&utm_source=a&utm_medium=b&keep2=true",
                        rule("^utm_")));
    }

    @Test
    void testOrderAndEncodingArePreserved() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/path?b=2&a=%20x+y&c",
                filter("https://example.com/path?b=2&utm_medium=x&a=%20x+y&c", rule("^utm_")));
    }

    @Test
    void testKeyOnlyAndEmptyValueStayDistinct() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/?a&b=",
                filter("https://example.com/?a&b=&utm_x=1", rule("^utm_")));
    }

    @Test
    void testFragmentIsKept() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/?a=1#top",
                filter("https://example.com/?utm_source=x&a=1#top", rule("^utm_")));
    }

    @Test
    void testNamesAreMatchedDecoded() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/?x=1",
                filter("https://example.com/?utm%5Fsource=1&x=1", rule("^utm_")));
    }

    @Test
    void testValuesAreNotMatched() {
        Assertions.assertEquals(
                Reason.NOTHING_TO_CLEAR,
                failure("https://example.com/?keep=utm_source", rule("^utm_")));
    }

    @Test
    void testUnanchoredPattern() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/?p=1",
                filter("https://example.com/?video_id=9&p=1", rule("id")));
    }

    @Test
    void testAnyPatternRemovesTheParameter() throws CleanException {
        Assertions.assertEquals(
                "https://twitter.com/user/status/1",
                filter("https://twitter.com/user/status/1?s=20&t=AVPOmNLt", rule("^s$", "^t$")));
    }

    @Test
    void testEmptyParametersAreDropped() throws CleanException {
        Assertions.assertEquals(
                "https://example.com/?a=1",
                filter("https://example.com/?a=1&&utm_x=2", rule("^utm_")));
    }

    @Test
    void testNothingToClear() {
        Assertions.assertEquals(
                Reason.NOTHING_TO_CLEAR, failure("https://example.com/?a=1&b=2", rule("^utm_")));
    }

    @Test
    void testNoQuery() {
        Assertions.assertEquals(Reason.NO_QUERY, failure("https://example.com/", rule("^utm_")));
        Assertions.assertEquals(Reason.NO_QUERY, failure("https://example.com/?", rule("^utm_")));
    }

    @Test
    void testNoQueryWithHooks() throws CleanException {
        Rule withHooks = rule(List.of("some-hook"), "^utm_");
        Assertions.assertEquals(
                "https://example.com/page", filter("https://example.com/page", withHooks));
        // an empty denylist does not matter either
        Assertions.assertEquals(
                "https://example.com/page", filter("https://example.com/page", rule(List.of("x"))));
    }

    @Test
    void testEmptyDenylist() {
        Assertions.assertEquals(
                Reason.NO_MATCH_RULE, failure("https://example.com/?utm_source=1", rule()));
    }

    @Test
    void testDecodeName() {
        Assertions.assertEquals("a b", QueryFilter.decodeName("a+b=1"));
        Assertions.assertEquals("utm_source", QueryFilter.decodeName("utm%5Fsource"));
        Assertions.assertEquals("", QueryFilter.decodeName("=value"));
    }
}
