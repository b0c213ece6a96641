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

/** A hook named by a rule is not registered or failed on the URL. */
public class HookExecutionException extends CleanException {

    public static final String NOT_FOUND = "not found";

    private final String hookName;

    private final String hookMessage;

    public HookExecutionException(@NotNull String hookName, @NotNull String hookMessage) {
        this(hookName, hookMessage, null);
    }

    public HookExecutionException(
            @NotNull String hookName, @NotNull String hookMessage, Throwable cause) {
        super(Reason.HOOK_EXECUTION, "Hook " + hookName + ": " + hookMessage, cause);
        this.hookName = hookName;
        this.hookMessage = hookMessage;
    }

    public String getHookName() {
        return hookName;
    }

    /** The error reported by the hook itself, {@value #NOT_FOUND} for a missing hook. */
    public String getHookMessage() {
        return hookMessage;
    }
}
