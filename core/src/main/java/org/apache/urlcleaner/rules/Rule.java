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

import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;

/**
 * Cleaning policy of a domain. Instances are immutable and shared by every domain key a
 * configuration entry expands to.
 */
public final class Rule {

    private final boolean redirect;

    private final List<Pattern> denylist;

    private final List<String> hooks;

    public Rule(boolean redirect, @NotNull List<Pattern> denylist, @NotNull List<String> hooks) {
        this.redirect = redirect;
        this.denylist = List.copyOf(denylist);
        this.hooks = List.copyOf(hooks);
    }

    /** Whether the URL has to be resolved through its redirects before being cleaned. */
    public boolean isRedirect() {
        return redirect;
    }

    public List<Pattern> getDenylist() {
        return denylist;
    }

    public List<String> getHooks() {
        return hooks;
    }

    public boolean hasHooks() {
        return !hooks.isEmpty();
    }

    /**
     * Returns true if any of the denylist patterns is found in the parameter name. Patterns are
     * not anchored, use <code>^</code> and <code>$</code> to match the whole name.
     */
    public boolean isDenied(@NotNull String parameterName) {
        for (Pattern pattern : denylist) {
            if (pattern.matcher(parameterName).find()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Rule[redirect=" + redirect + ", denylist=" + denylist + ", hooks=" + hooks + "]";
    }
}
