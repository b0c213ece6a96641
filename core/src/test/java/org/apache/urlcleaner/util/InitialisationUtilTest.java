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
package org.apache.urlcleaner.util;

import org.apache.urlcleaner.hooks.DomainMirrorHook;
import org.apache.urlcleaner.hooks.UrlHook;
import org.apache.urlcleaner.hooks.VideoIdDecodeHook;
import org.apache.urlcleaner.util.exceptions.InitialisationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InitialisationUtilTest {

    /** No empty constructor. */
    public static class HookWithName extends DomainMirrorHook {
        public HookWithName(String name) {}
    }

    @Test
    void can_initialize_a_hook_as_its_own_class() {
        final VideoIdDecodeHook hook =
                InitialisationUtil.initializeFromQualifiedName(
                        VideoIdDecodeHook.class.getName(), VideoIdDecodeHook.class);
        Assertions.assertEquals(VideoIdDecodeHook.NAME, hook.getName());
    }

    @Test
    void can_initialize_a_hook_as_abstract_class() {
        final UrlHook hook =
                InitialisationUtil.initializeFromQualifiedName(
                        DomainMirrorHook.class.getName(), UrlHook.class);
        Assertions.assertTrue(hook instanceof DomainMirrorHook);
    }

    @Test
    void can_initialize_a_hook_as_interface() {
        final Configurable configurable =
                InitialisationUtil.initializeFromQualifiedName(
                        DomainMirrorHook.class.getName(), Configurable.class);
        Assertions.assertEquals(DomainMirrorHook.NAME, configurable.getName());
    }

    @Test
    void fails_if_class_to_initialize_not_existing() {
        Assertions.assertThrows(
                InitialisationException.class,
                () ->
                        InitialisationUtil.initializeFromQualifiedName(
                                "does.not.exist.MyHook", UrlHook.class));
    }

    @Test
    void fails_if_class_to_initialize_is_abstract() {
        Assertions.assertThrows(
                InitialisationException.class,
                () ->
                        InitialisationUtil.initializeFromQualifiedName(
                                UrlHook.class.getName(), UrlHook.class));
    }

    @Test
    void fails_if_class_to_initialize_is_interface() {
        Assertions.assertThrows(
                InitialisationException.class,
                () ->
                        InitialisationUtil.initializeFromQualifiedName(
                                Configurable.class.getName(), Configurable.class));
    }

    @Test
    void fails_if_class_to_initialize_not_extending_superclass() {
        Assertions.assertThrows(
                InitialisationException.class,
                () ->
                        InitialisationUtil.initializeFromQualifiedName(
                                String.class.getName(), UrlHook.class));
    }

    @Test
    void fails_if_qualified_class_name_is_blank() {
        Assertions.assertThrows(
                InitialisationException.class,
                () -> InitialisationUtil.initializeFromQualifiedName("   ", UrlHook.class));
    }

    @Test
    void fails_if_class_to_initialize_has_no_empty_constructor() {
        Assertions.assertThrows(
                InitialisationException.class,
                () ->
                        InitialisationUtil.initializeFromQualifiedName(
                                HookWithName.class.getName(), UrlHook.class));
    }
}
