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

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Defines a generic behaviour for the components which load their resources from a JSON file. */
public interface JSONResource {

    /**
     * @return filename of the JSON resource
     */
    String getResourceFile();

    /**
     * Load the resources from an input stream
     *
     * @throws IOException if the stream could not be read or parsed
     */
    void loadJSONResources(InputStream inputStream) throws IOException;

    /**
     * Load the resources from the JSON file. A file found on the local file system takes precedence
     * over a resource of the same name on the classpath.
     *
     * @throws IOException if the resource could not be found, read or parsed
     */
    default void loadJSONResources() throws IOException {
        final String resourceFile = getResourceFile();
        final Path path = Paths.get(resourceFile);
        if (Files.isRegularFile(path)) {
            try (InputStream inputStream = new FileInputStream(path.toFile())) {
                loadJSONResources(inputStream);
            }
            return;
        }
        try (InputStream inputStream =
                getClass().getClassLoader().getResourceAsStream(resourceFile)) {
            if (inputStream == null) {
                throw new FileNotFoundException("Resource not found: " + resourceFile);
            }
            loadJSONResources(inputStream);
        }
    }
}
