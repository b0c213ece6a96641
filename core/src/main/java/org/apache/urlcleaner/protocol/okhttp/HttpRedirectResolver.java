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
package org.apache.urlcleaner.protocol.okhttp;

import java.io.IOException;
import java.net.ProtocolException;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.lang.StringUtils;
import org.apache.urlcleaner.protocol.RedirectResolver;
import org.apache.urlcleaner.util.ConfUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves redirects with OkHttp. Redirects are followed here rather than by the client so that
 * their number can be bounded by <code>http.max.redirects</code>. Each hop is requested with HEAD
 * unless <code>http.method.head</code> is false; servers answering HEAD with 405 or 501 are asked
 * again with GET. Response bodies are never read.
 */
public class HttpRedirectResolver implements RedirectResolver {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRedirectResolver.class);

    public static final String AGENT_PARAM = "http.agent";

    public static final String TIMEOUT_PARAM = "http.timeout";

    public static final String CALL_TIMEOUT_PARAM = "http.call.timeout";

    public static final String MAX_REDIRECTS_PARAM = "http.max.redirects";

    public static final String USE_HEAD_PARAM = "http.method.head";

    private final OkHttpClient client;

    private final String userAgent;

    private final int maxRedirects;

    private final boolean useHead;

    public HttpRedirectResolver() {
        this(Map.of());
    }

    public HttpRedirectResolver(@NotNull Map<String, Object> conf) {
        final int timeout = ConfUtils.getInt(conf, TIMEOUT_PARAM, 10000);
        final int callTimeout = ConfUtils.getInt(conf, CALL_TIMEOUT_PARAM, 30000);

        maxRedirects = ConfUtils.getInt(conf, MAX_REDIRECTS_PARAM, 10);
        useHead = ConfUtils.getBoolean(conf, USE_HEAD_PARAM, true);

        final String agent = ConfUtils.getString(conf, AGENT_PARAM);
        userAgent = StringUtils.isNotBlank(agent) ? agent : "urlcleaner";

        client =
                new OkHttpClient.Builder()
                        .followRedirects(false)
                        .followSslRedirects(false)
                        .connectTimeout(timeout, TimeUnit.MILLISECONDS)
                        .writeTimeout(timeout, TimeUnit.MILLISECONDS)
                        .readTimeout(timeout, TimeUnit.MILLISECONDS)
                        .callTimeout(callTimeout, TimeUnit.MILLISECONDS)
                        .build();

        LOG.debug(
                "Redirect resolution with timeout {} ms, max. {} redirects, HEAD {}",
                timeout,
                maxRedirects,
                useHead);
    }

    @Override
    public @NotNull HttpUrl resolve(@NotNull HttpUrl url) throws IOException {
        HttpUrl current = url;
        int numRedirects = 0;
        while (true) {
            final String location;
            final int code;
            try (Response response = fetch(current)) {
                code = response.code();
                location = response.header("Location");
            }
            if (!isRedirect(code)) {
                LOG.debug("Resolved {} to {} ({})", url, current, code);
                return current;
            }
            if (StringUtils.isBlank(location)) {
                LOG.debug("Got redirect response {} for {} without location", code, current);
                return current;
            }
            if (numRedirects >= maxRedirects) {
                throw new ProtocolException(
                        "Too many redirects (" + maxRedirects + ") starting from " + url);
            }
            numRedirects++;
            HttpUrl next = current.resolve(location);
            if (next == null) {
                throw new ProtocolException(
                        "Invalid redirect location '" + location + "' from " + current);
            }
            LOG.debug("Redirected from {} to {}", current, next);
            current = next;
        }
    }

    private Response fetch(HttpUrl url) throws IOException {
        final Request.Builder rb = new Request.Builder().url(url).header("User-Agent", userAgent);
        if (useHead) {
            Response response = execute(rb.head().build());
            int code = response.code();
            if (code != 405 && code != 501) {
                return response;
            }
            response.close();
            LOG.debug("HEAD not supported by {} ({}), trying GET", url.host(), code);
        }
        return execute(rb.get().build());
    }

    private Response execute(Request request) throws IOException {
        final Call call = client.newCall(request);
        return call.execute();
    }

    private static boolean isRedirect(int code) {
        return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
    }
}
