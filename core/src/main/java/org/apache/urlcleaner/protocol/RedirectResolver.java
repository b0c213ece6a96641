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
package org.apache.urlcleaner.protocol;

import java.io.IOException;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;

/**
 * Follows the redirects of a URL and returns where they lead. Implementations are shared between
 * threads and are responsible for bounding the number of redirects and the time spent.
 */
public interface RedirectResolver {

    /**
     * @return the URL reached once all redirects have been followed, the input itself if it does
     *     not redirect
     * @throws IOException if the resolution failed or timed out
     */
    @NotNull
    HttpUrl resolve(@NotNull HttpUrl url) throws IOException;
}
