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
package trellis.routing;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates dispatchers that share the application's filter stack. Filters are registered once at startup with add().
 */
public class DispatcherFactory {

    private static final List<DispatcherFilter> stack = new ArrayList<>();

    public static synchronized void add(DispatcherFilter filter) {
        stack.add(filter);
    }

    public static synchronized List<DispatcherFilter> filters() {
        return new ArrayList<>(stack);
    }

    public static synchronized void clear() {
        stack.clear();
    }

    /** Create a new dispatcher, with every registered filter added in registration order. */
    public static Dispatcher create() {
        Dispatcher dispatcher = new Dispatcher();
        for (DispatcherFilter filter : filters()) {
            dispatcher.addFilter(filter);
        }
        return dispatcher;
    }
}
