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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;
import okhttp3.HttpUrl;
import org.apache.commons.lang.StringUtils;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.urlcleaner.CleanException;
import org.apache.urlcleaner.CleanException.Reason;
import org.apache.urlcleaner.rules.Rule;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes from the query of a URL the parameters whose name matches the denylist of a {@link
 * Rule}. Only names are matched, against their decoded form. The parameters kept are written back
 * verbatim and in their original order, so that <code>a</code> and <code>a=</code> stay distinct.
 */
public final class QueryFilter {

    private static final Logger LOG = LoggerFactory.getLogger(QueryFilter.class);

    private QueryFilter() {}

    /**
     * Returns the URL without the denied query parameters.
     *
     * <p>A URL without query (or with an empty one) is returned as is when the rule has hooks to
     * apply, otherwise it is rejected with {@link Reason#NO_QUERY}.
     *
     * @throws CleanException {@link Reason#NO_QUERY} as above, {@link Reason#NO_MATCH_RULE} if the
     *     rule has no denylist, {@link Reason#NOTHING_TO_CLEAR} if no parameter was removed
     */
    @NotNull
    public static HttpUrl filter(@NotNull HttpUrl url, @NotNull Rule rule) throws CleanException {
        final String query = url.encodedQuery();
        if (StringUtils.isEmpty(query)) {
            if (rule.hasHooks()) {
                return url;
            }
            throw new CleanException(Reason.NO_QUERY, "No query to clean in " + url);
        }

        if (rule.getDenylist().isEmpty()) {
            throw new CleanException(
                    Reason.NO_MATCH_RULE, "Empty denylist for domain <" + url.host() + ">");
        }

        final StringJoiner kept = new StringJoiner("&");
        for (String parameter : StringUtils.splitPreserveAllTokens(query, '&')) {
            if (parameter.isEmpty()) {
                continue;
            }
            String name = decodeName(parameter);
            if (rule.isDenied(name)) {
                LOG.debug("Removing parameter {} from {}", name, url);
                continue;
            }
            kept.add(parameter);
        }

        final String newQuery = kept.toString();
        if (newQuery.equals(query)) {
            throw new CleanException(Reason.NOTHING_TO_CLEAR, "Nothing to clear in " + url);
        }

        return url.newBuilder().encodedQuery(newQuery.isEmpty() ? null : newQuery).build();
    }

    /** Name of a <code>name=value</code> parameter, form-decoded. */
    static String decodeName(@NotNull String parameter) {
        List<NameValuePair> pairs = URLEncodedUtils.parse(parameter, StandardCharsets.UTF_8, '&');
        if (pairs.isEmpty()) {
            return StringUtils.substringBefore(parameter, "=");
        }
        return pairs.get(0).getName();
    }
}
