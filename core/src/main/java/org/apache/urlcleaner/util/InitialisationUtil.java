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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import org.apache.commons.lang.StringUtils;
import org.apache.urlcleaner.util.exceptions.InitialisationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

public final class InitialisationUtil {

    /**
     * Initializes a class from {@code qualifiedClassName} as type {@code superClass}.
     *
     * <p>The class must be concrete, have an accessible empty constructor and extend or implement
     * {@code superClass}.
     *
     * @param qualifiedClassName the qualified name for the class to be initialized.
     * @param superClass defines the type to be instantiated
     * @param <T> the type of the returned class.
     * @return an instance of {@code qualifiedClassName} of type {@code superClass}
     * @throws InitialisationException if the class is missing, blank, abstract, not assignable to
     *     {@code superClass} or if its constructor failed.
     */
    @NotNull
    @Contract(pure = true)
    public static <T> T initializeFromQualifiedName(
            @NotNull String qualifiedClassName, @NotNull Class<? extends T> superClass) {
        return initializeFromClassUnchecked(getClassFor(qualifiedClassName, superClass));
    }

    @NotNull
    @Contract(pure = true)
    public static <T> Class<? extends T> getClassFor(
            @NotNull String qualifiedClassName, @NotNull Class<? extends T> superClass) {
        if (StringUtils.isBlank(qualifiedClassName)) {
            throw new InitialisationException("The qualified class name is empty!");
        }
        try {
            Class<?> clazz = Class.forName(qualifiedClassName);
            return requireSuperClass(clazz, superClass);
        } catch (ClassNotFoundException e) {
            throw new InitialisationException(
                    "The class " + qualifiedClassName + " was not found!", e);
        }
    }

    @NotNull
    @Contract(pure = true)
    private static <T> T initializeFromClassUnchecked(@NotNull Class<? extends T> clazz) {
        try {
            final Constructor<? extends T> declaredConstructor = clazz.getDeclaredConstructor();
            return declaredConstructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new InitialisationException("The underlying constructor threw an exception.", e);
        } catch (InstantiationException e) {
            throw new InitialisationException("The underlying class is abstract.", e);
        } catch (IllegalAccessException e) {
            throw new InitialisationException(
                    "The constructor of " + clazz.getName() + " is inaccessible.", e);
        } catch (NoSuchMethodException e) {
            throw new InitialisationException(
                    "There was no empty constructor found for " + clazz.getName() + ".", e);
        }
    }

    @SuppressWarnings("unchecked")
    @Contract(pure = true)
    static <T> Class<? extends T> requireSuperClass(
            @NotNull Class<?> clazz, @NotNull Class<? extends T> superClass) {
        if (clazz.isInterface()) {
            throw new InitialisationException(clazz.getName() + " is an interface!");
        } else if (Modifier.isAbstract(clazz.getModifiers())) {
            throw new InitialisationException(clazz.getName() + " is an abstract class!");
        }
        if (!superClass.isAssignableFrom(clazz)) {
            throw new InitialisationException(
                    "Class " + clazz.getName() + " must extend " + superClass.getName());
        }
        return (Class<? extends T>) clazz;
    }

    private InitialisationUtil() {}
}
