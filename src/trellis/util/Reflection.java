/**
 * This file is part of the Trellis Web Framework.
 * 
 * @author Luke Hutchison
 * 
 * --
 * 
 * @license Apache 2.0 
 * 
 * Copyright 2015 Luke Hutchison
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package trellis.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

public class Reflection {

    /**
     * Find a class by name, returning null if there is no class of that name on the classpath, or if the class
     * could not be linked or initialized.
     */
    public static Class<?> classForNameOrNull(String className) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = Reflection.class.getClassLoader();
        }
        try {
            return Class.forName(className, /* initialize = */true, classLoader);
        } catch (ClassNotFoundException | NoClassDefFoundError e) {
            return null;
        } catch (LinkageError e) {
            Log.warning("Could not load class " + className + ": " + e);
            return null;
        }
    }

    /**
     * Instantiate a class using the public constructor with the given parameter types. Unchecked exceptions thrown
     * by the constructor itself are rethrown unchanged.
     * 
     * @throws InstantiationException
     *             if the class is abstract, has no matching public constructor, or the constructor threw a checked
     *             exception.
     */
    public static <T> T instantiateWithConstructor(Class<T> klass, Class<?>[] paramTypes, Object... args)
            throws InstantiationException {
        if ((klass.getModifiers() & Modifier.ABSTRACT) != 0) {
            throw new InstantiationException("Class " + klass.getName() + " is abstract");
        }
        Constructor<T> constructor;
        try {
            constructor = klass.getConstructor(paramTypes);
        } catch (NoSuchMethodException e) {
            throw new InstantiationException("Class " + klass.getName() + " has no public constructor taking "
                    + paramTypes.length + " parameter(s) of the required types");
        }
        try {
            return constructor.newInstance(args);

        } catch (InvocationTargetException e) {
            // If the constructor throws an exception, it gets wrapped in an InvocationTargetException.
            // Unwrap it and re-throw it if it is unchecked.
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            InstantiationException instantiationException = new InstantiationException(
                    "Constructor of " + klass.getName() + " threw " + cause);
            instantiationException.initCause(cause);
            throw instantiationException;

        } catch (IllegalAccessException e) {
            throw new InstantiationException("Could not instantiate class of type " + klass.getName());
        }
    }

}
