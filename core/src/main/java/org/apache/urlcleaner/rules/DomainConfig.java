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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Configuration entry of a domain, as found in a rules file:
 *
 * <pre>{@code
 * "bilibili.com": {
 *   "subdomains": ["www", "m"],
 *   "redirect": false,
 *   "denylist": ["^spm_id_from$", "^vd_source$"],
 *   "hooks": ["video-id-decode"]
 * }
 * }</pre>
 *
 * <p><code>sub</code> and <code>ban</code> are accepted as aliases of <code>subdomains</code> and
 * <code>denylist</code>.
 */
public class DomainConfig {

    @Nullable private final List<String> subdomains;

    private final boolean redirect;

    private final List<String> denylist;

    private final List<String> hooks;

    @JsonCreator
    public DomainConfig(
            @JsonProperty("subdomains") @JsonAlias("sub") @Nullable List<String> subdomains,
            @JsonProperty("redirect") @Nullable Boolean redirect,
            @JsonProperty("denylist") @JsonAlias("ban") @Nullable List<String> denylist,
            @JsonProperty("hooks") @Nullable List<String> hooks) {
        this.subdomains = subdomains;
        this.redirect = redirect != null && redirect;
        this.denylist = denylist == null ? Collections.emptyList() : denylist;
        this.hooks = hooks == null ? Collections.emptyList() : hooks;
    }

    public DomainConfig(boolean redirect, List<String> denylist) {
        this(null, redirect, denylist, null);
    }

    /** Subdomain prefixes the entry expands to, null if it applies to the key itself. */
    @Nullable
    public List<String> getSubdomains() {
        return subdomains;
    }

    public boolean isRedirect() {
        return redirect;
    }

    public List<String> getDenylist() {
        return denylist;
    }

    public List<String> getHooks() {
        return hooks;
    }
}
