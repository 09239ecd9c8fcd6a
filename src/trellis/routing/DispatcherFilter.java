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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import trellis.event.Event;
import trellis.event.EventListener;

/**
 * A filter that is run before and after each request is dispatched. Subclasses override beforeDispatch and/or
 * afterDispatch. An afterDispatch callback may replace the "response" data of the event.
 */
public abstract class DispatcherFilter implements EventListener {

    public static final String BEFORE_DISPATCH = "Dispatcher.beforeDispatch";
    public static final String AFTER_DISPATCH = "Dispatcher.afterDispatch";

    @Override
    public Map<String, Consumer<Event>> implementedEvents() {
        Map<String, Consumer<Event>> events = new LinkedHashMap<>();
        events.put(BEFORE_DISPATCH, this::beforeDispatch);
        events.put(AFTER_DISPATCH, this::afterDispatch);
        return events;
    }

    public void beforeDispatch(Event event) {
    }

    public void afterDispatch(Event event) {
    }
}
