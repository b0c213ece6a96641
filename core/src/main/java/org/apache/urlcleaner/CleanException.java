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

import org.jetbrains.annotations.NotNull;

/**
 * Reason why {@link UrlCleaner#clear(String)} did not produce a cleaned URL. Apart from {@link
 * Reason#REDIRECT_FAIL} and {@link Reason#HOOK_EXECUTION} these describe inputs which needed no
 * cleaning rather than failures, see {@link #isNoOp()}.
 */
public class CleanException extends Exception {

    public enum Reason {
        /** the input is not a valid URL */
        URL_PARSE,
        /** the URL has no host */
        NO_DOMAIN,
        /** a valid URL with a host but a scheme other than http or https */
        UNSUPPORTED_SCHEME,
        /** the URL has no query and its rule has no hooks */
        NO_QUERY,
        /** resolving the redirects of the URL failed */
        REDIRECT_FAIL,
        /** no rule applies to the domain or its rule has an empty denylist */
        NO_MATCH_RULE,
        /** none of the query parameters had to be removed */
        NOTHING_TO_CLEAR,
        /** a hook is missing from the registry or failed */
        HOOK_EXECUTION
    }

    private final Reason reason;

    public CleanException(@NotNull Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CleanException(@NotNull Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    @NotNull
    public Reason getReason() {
        return reason;
    }

    /**
     * True when the input simply needed no cleaning, callers usually keep the original URL in that
     * case without reporting anything.
     */
    public boolean isNoOp() {
        return reason == Reason.NO_QUERY
                || reason == Reason.UNSUPPORTED_SCHEME
                || reason == Reason.NOTHING_TO_CLEAR
                || reason == Reason.NO_MATCH_RULE;
    }
}
