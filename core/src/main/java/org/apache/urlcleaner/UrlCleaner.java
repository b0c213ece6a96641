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
package org.apache.urlcleaner;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import okhttp3.HttpUrl;
import org.apache.urlcleaner.CleanException.Reason;
import org.apache.urlcleaner.filtering.QueryFilter;
import org.apache.urlcleaner.hooks.HookException;
import org.apache.urlcleaner.hooks.HookRegistry;
import org.apache.urlcleaner.hooks.UrlHook;
import org.apache.urlcleaner.protocol.RedirectResolver;
import org.apache.urlcleaner.protocol.okhttp.HttpRedirectResolver;
import org.apache.urlcleaner.rules.Rule;
import org.apache.urlcleaner.rules.RuleStore;
import org.apache.urlcleaner.rules.RuleStoreLoader;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the tracking parameters from URLs according to the {@link Rule} of their domain.
 *
 * <p>Cleaning a URL goes through the following steps, the first one failing ends it:
 *
 * <ol>
 *   <li>parse the URL and get its host
 *   <li>find the rule of the host, or the default rule
 *   <li>if the rule says so, resolve the redirects of the URL and find the rule of the host it
 *       leads to. This is done once, the new rule is never redirected again
 *   <li>remove the query parameters matching the denylist of the rule
 *   <li>apply the hooks of the rule in order
 * </ol>
 *
 * Instances hold no mutable state and can be shared between threads. Only the redirect resolution
 * blocks.
 */
public class UrlCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(UrlCleaner.class);

    private final RuleStore rules;

    private final HookRegistry hooks;

    private final RedirectResolver resolver;

    public UrlCleaner(
            @NotNull RuleStore rules,
            @NotNull HookRegistry hooks,
            @NotNull RedirectResolver resolver) {
        this.rules = rules;
        this.hooks = hooks;
        this.resolver = resolver;
    }

    /**
     * Builds a cleaner from the configuration: rules from <code>urlcleaner.rules.file</code>, hooks
     * from <code>urlcleaner.hooks.file</code> in addition to the built-in ones and an HTTP redirect
     * resolver configured with the <code>http.*</code> keys.
     *
     * @throws org.apache.urlcleaner.rules.RuleConfigurationException if the rules can't be loaded
     */
    @NotNull
    public static UrlCleaner fromConf(@NotNull Map<String, Object> conf) {
        RuleStore rules = RuleStoreLoader.fromConf(conf);
        HookRegistry hooks = HookRegistry.fromConf(conf);
        return new UrlCleaner(rules, hooks, new HttpRedirectResolver(conf));
    }

    /**
     * Returns the cleaned version of the URL.
     *
     * @throws CleanException with the {@link Reason} the URL was not cleaned
     */
    @NotNull
    public HttpUrl clear(@NotNull String rawUrl) throws CleanException {
        HttpUrl url = parse(rawUrl);

        Rule rule = findRule(url);

        if (rule.isRedirect()) {
            long start = System.currentTimeMillis();
            try {
                url = resolver.resolve(url);
            } catch (IOException e) {
                throw new CleanException(
                        Reason.REDIRECT_FAIL,
                        "Failed to resolve the redirection of " + rawUrl + ": " + e.getMessage(),
                        e);
            }
            LOG.debug(
                    "Redirect of {} resolved to {} in {} msec",
                    rawUrl,
                    url,
                    System.currentTimeMillis() - start);
            rule = findRule(url);
        }

        url = QueryFilter.filter(url, rule);

        for (String name : rule.getHooks()) {
            url = applyHook(name, url);
        }

        return url;
    }

    /**
     * Returns the cleaned URL as a String or the input unchanged if it could not be cleaned, for
     * whichever reason.
     */
    @NotNull
    public String clearQuietly(@NotNull String rawUrl) {
        try {
            return clear(rawUrl).toString();
        } catch (CleanException e) {
            if (e.isNoOp()) {
                LOG.trace("{} left unchanged: {}", rawUrl, e.getMessage());
            } else {
                LOG.debug("Failed to clean {}: {}", rawUrl, e.getMessage());
            }
            return rawUrl;
        }
    }

    /**
     * Only http and https URLs are cleaned. Other valid absolute URIs are told apart from
     * malformed input: without a host they are {@link Reason#NO_DOMAIN}, with one {@link
     * Reason#UNSUPPORTED_SCHEME}.
     */
    private static HttpUrl parse(String rawUrl) throws CleanException {
        final String trimmed = rawUrl.trim();
        HttpUrl url = HttpUrl.parse(trimmed);
        if (url != null) {
            return url;
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new CleanException(Reason.URL_PARSE, "Invalid URL " + rawUrl, e);
        }
        // http(s) URIs rejected by HttpUrl, e.g. with an out of range port, are malformed
        if (!uri.isAbsolute()
                || "http".equalsIgnoreCase(uri.getScheme())
                || "https".equalsIgnoreCase(uri.getScheme())) {
            throw new CleanException(Reason.URL_PARSE, "Invalid URL " + rawUrl);
        }
        if (uri.getHost() == null) {
            throw new CleanException(Reason.NO_DOMAIN, "No domain in URL " + rawUrl);
        }
        throw new CleanException(
                Reason.UNSUPPORTED_SCHEME,
                "Unsupported scheme " + uri.getScheme() + " in URL " + rawUrl);
    }

    private Rule findRule(HttpUrl url) throws CleanException {
        String domain = url.host();
        Rule rule = rules.lookup(domain);
        if (rule == null) {
            throw new CleanException(Reason.NO_MATCH_RULE, "No rule for domain <" + domain + ">");
        }
        return rule;
    }

    private HttpUrl applyHook(String name, HttpUrl url) throws HookExecutionException {
        @Nullable UrlHook hook = hooks.get(name);
        if (hook == null) {
            throw new HookExecutionException(name, HookExecutionException.NOT_FOUND);
        }
        long start = System.currentTimeMillis();
        HttpUrl result;
        try {
            result = hook.apply(url);
        } catch (HookException e) {
            throw new HookExecutionException(name, e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Hook {} threw an exception on {}", name, url, e);
            throw new HookExecutionException(name, String.valueOf(e.getMessage()), e);
        }
        LOG.debug("Hook {} took {} msec => {}", name, System.currentTimeMillis() - start, result);
        return result;
    }

    public RuleStore getRules() {
        return rules;
    }

    public HookRegistry getHooks() {
        return hooks;
    }
}
