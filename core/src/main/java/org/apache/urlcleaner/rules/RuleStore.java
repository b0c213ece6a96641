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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup table from domain to {@link Rule}, built once from a configuration. Entries
 * declaring subdomains are expanded to one key per <code>subdomain.base</code>, all of them
 * pointing to the same Rule. The key {@value #DEFAULT_KEY} holds the rule used for domains without
 * an entry of their own.
 */
public final class RuleStore {

    private static final Logger LOG = LoggerFactory.getLogger(RuleStore.class);

    public static final String DEFAULT_KEY = "default";

    private final Map<String, Rule> rules;

    private RuleStore(Map<String, Rule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    /**
     * Compiles the configuration into a RuleStore.
     *
     * @param config domain or base domain to its configuration entry, iterated in its own order
     * @throws RuleConfigurationException if a denylist entry is not a valid regular expression
     */
    @NotNull
    public static RuleStore build(@NotNull Map<String, DomainConfig> config) {
        Map<String, Rule> rules = new HashMap<>();
        for (Map.Entry<String, DomainConfig> entry : config.entrySet()) {
            final String base = entry.getKey();
            final DomainConfig domainConfig = entry.getValue();
            if (domainConfig == null) {
                throw new RuleConfigurationException("No configuration for domain " + base);
            }
            requireNoNull(base, "denylist", domainConfig.getDenylist());
            requireNoNull(base, "hooks", domainConfig.getHooks());
            requireNoNull(base, "subdomains", domainConfig.getSubdomains());

            final Rule rule =
                    new Rule(
                            domainConfig.isRedirect(),
                            compile(base, domainConfig.getDenylist()),
                            domainConfig.getHooks());

            final List<String> subdomains = domainConfig.getSubdomains();
            if (subdomains == null) {
                put(rules, base, rule);
                continue;
            }
            for (String sub : subdomains) {
                // an empty prefix stands for the base domain itself
                String domain = sub.isEmpty() ? base : sub + "." + base;
                put(rules, domain, rule);
            }
        }
        LOG.info("Built rule store with {} domains from {} entries", rules.size(), config.size());
        return new RuleStore(rules);
    }

    private static void requireNoNull(String domain, String field, @Nullable List<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value == null) {
                throw new RuleConfigurationException(
                        "Null entry in " + field + " for domain " + domain);
            }
        }
    }

    private static List<Pattern> compile(String domain, List<String> denylist) {
        List<Pattern> patterns = new ArrayList<>(denylist.size());
        for (String regex : denylist) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new RuleConfigurationException(
                        "Invalid denylist pattern '"
                                + regex
                                + "' for domain "
                                + domain
                                + ": "
                                + e.getDescription(),
                        e);
            }
        }
        return patterns;
    }

    private static void put(Map<String, Rule> rules, String domain, Rule rule) {
        if (rules.put(domain, rule) != null) {
            LOG.warn("Domain {} is configured more than once, keeping the last entry", domain);
        }
    }

    /** Returns the rule configured for exactly this domain, null if there is none. */
    @Nullable
    public Rule get(@NotNull String domain) {
        return rules.get(domain);
    }

    /**
     * Returns the rule of the domain or, if it has none, the {@value #DEFAULT_KEY} rule. Null if
     * neither exists.
     */
    @Nullable
    public Rule lookup(@NotNull String domain) {
        Rule rule = rules.get(domain);
        if (rule == null) {
            rule = rules.get(DEFAULT_KEY);
        }
        return rule;
    }

    public Set<String> domains() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }
}
