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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import trellis.event.Event;
import trellis.event.EventManager;

/** Runs the dispatch lifecycle events of a request through an ordered list of filters. */
public class Dispatcher {

    private final EventManager eventManager = new EventManager();
    private final List<DispatcherFilter> filters = new ArrayList<>();

    public EventManager getEventManager() {
        return eventManager;
    }

    /** Add a filter, attaching it to this dispatcher's event manager. */
    public Dispatcher addFilter(DispatcherFilter filter) {
        filters.add(filter);
        eventManager.on(filter);
        return this;
    }

    public List<DispatcherFilter> filters() {
        return Collections.unmodifiableList(filters);
    }

    /** Dispatch a lifecycle event with this dispatcher as its subject. */
    public Event dispatchEvent(String eventName, Map<String, ?> data) {
        return eventManager.dispatch(new Event(eventName, this, data));
    }
}
