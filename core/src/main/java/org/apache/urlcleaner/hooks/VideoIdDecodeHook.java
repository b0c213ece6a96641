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
package org.apache.urlcleaner.hooks;

import java.util.Arrays;
import java.util.List;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;

/**
 * Rewrites video URLs using the 12 character <code>BV</code> identifier into their numeric
 * <code>av</code> form, e.g. <code>/video/BV17x411w7KC/</code> becomes <code>/video/av170001/
 * </code>. Everything but the identifier segment is kept.
 *
 * <p>The identifier is a base 58 number with a custom alphabet, spread over 6 fixed positions and
 * offset by constants.
 */
public class VideoIdDecodeHook extends UrlHook {

    public static final String NAME = "video-id-decode";

    static final String ALPHABET = "fZodR9XQDSUm21yCkr6zBqiveYah8bt4xsWpHnJE7jL5VG3guMTKNPAwcF";

    /** Positions of the base 58 digits in the identifier, least significant first. */
    static final int[] SELECT = {11, 10, 3, 8, 4, 6};

    static final long XOR = 177451812L;

    static final long ADD = 8728348608L;

    static final String VIDEO_SEGMENT = "video";

    static final String ID_PREFIX = "BV";

    static final int ID_LENGTH = 12;

    static final String OUTPUT_PREFIX = "av";

    private static final int[] TRANSLATE = new int[128];

    static {
        Arrays.fill(TRANSLATE, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            TRANSLATE[ALPHABET.charAt(i)] = i;
        }
    }

    public VideoIdDecodeHook() {
        super(NAME);
    }

    @Override
    public @NotNull HttpUrl apply(@NotNull HttpUrl url) throws HookException {
        List<String> segments = url.encodedPathSegments();
        if (segments.size() < 2) {
            throw new HookException(
                    "not a valid video URL: path has fewer than 2 segments: " + url.encodedPath());
        }
        if (!VIDEO_SEGMENT.equals(segments.get(0))) {
            throw new HookException(
                    "not a valid video URL: path does not start with /" + VIDEO_SEGMENT);
        }
        long id = decode(segments.get(1));
        return url.newBuilder().setEncodedPathSegment(1, OUTPUT_PREFIX + id).build();
    }

    /**
     * Decodes a <code>BV</code> identifier into its numeric id.
     *
     * @throws HookException if the identifier is malformed
     */
    public static long decode(@NotNull String identifier) throws HookException {
        if (!identifier.startsWith(ID_PREFIX) || identifier.length() != ID_LENGTH) {
            throw new HookException(
                    "not a valid video URL: '"
                            + identifier
                            + "' is not a "
                            + ID_LENGTH
                            + " characters identifier starting with "
                            + ID_PREFIX);
        }
        long sum = 0;
        long power = 1;
        for (int position : SELECT) {
            char c = identifier.charAt(position);
            int value = c < TRANSLATE.length ? TRANSLATE[c] : -1;
            if (value < 0) {
                throw new HookException(
                        "not a valid video URL: unexpected character '"
                                + c
                                + "' in identifier "
                                + identifier);
            }
            sum += value * power;
            power *= ALPHABET.length();
        }
        if (sum < ADD) {
            throw new HookException(
                    "not a valid video URL: identifier " + identifier + " is out of range");
        }
        return (sum - ADD) ^ XOR;
    }
}
