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
package trellis.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom error handlers, keyed by exception class. A handler registered for a class also handles that class's
 * subclasses, unless a handler is registered for a closer superclass.
 */
public class ExceptionHandlerRegistry {

    private final Map<Class<? extends Throwable>, CustomErrorHandler<?>> handlers = new LinkedHashMap<>();

    public <T extends Throwable> ExceptionHandlerRegistry register(Class<T> exceptionType,
            CustomErrorHandler<? super T> handler) {
        handlers.put(exceptionType, handler);
        return this;
    }

    public void unregister(Class<? extends Throwable> exceptionType) {
        handlers.remove(exceptionType);
    }

    /**
     * Find the handler for exceptionType or its closest registered superclass, or null if there is none. The
     * returned handler must only be called with instances of exceptionType.
     */
    @SuppressWarnings("unchecked")
    public CustomErrorHandler<Throwable> find(Class<? extends Throwable> exceptionType) {
        for (Class<?> klass = exceptionType; klass != null; klass = klass.getSuperclass()) {
            CustomErrorHandler<?> handler = handlers.get(klass);
            if (handler != null) {
                return (CustomErrorHandler<Throwable>) handler;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }
}
