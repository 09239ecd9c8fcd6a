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
package trellis.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Consumer;

import trellis.util.Log;

/**
 * Synchronous event dispatch. Listeners are called in the order they were attached; a listener can stop an event
 * from reaching later listeners. Exceptions thrown by listeners propagate to the code that dispatched the event.
 */
public class EventManager {

    private static final int WARN_DISPATCH_DEPTH = 50;

    private final Map<String, List<Consumer<Event>>> eventListeners = new LinkedHashMap<>();

    /** Listener objects that have been attached, with the callbacks they were attached with. */
    private final Map<EventListener, Map<String, Consumer<Event>>> attachedListeners = new IdentityHashMap<>();

    private int dispatchDepth;

    /** Attach a callback to a single event. */
    public EventManager on(String eventName, Consumer<Event> callback) {
        eventListeners.computeIfAbsent(eventName, k -> new ArrayList<>()).add(callback);
        return this;
    }

    /** Attach all the callbacks of a listener object. Attaching the same listener object twice has no effect. */
    public EventManager on(EventListener listener) {
        if (attachedListeners.containsKey(listener)) {
            return this;
        }
        Map<String, Consumer<Event>> implementedEvents = listener.implementedEvents();
        attachedListeners.put(listener, implementedEvents);
        for (Entry<String, Consumer<Event>> ent : implementedEvents.entrySet()) {
            on(ent.getKey(), ent.getValue());
        }
        return this;
    }

    /** Detach all the callbacks of a listener object. */
    public EventManager off(EventListener listener) {
        Map<String, Consumer<Event>> implementedEvents = attachedListeners.remove(listener);
        if (implementedEvents != null) {
            for (Entry<String, Consumer<Event>> ent : implementedEvents.entrySet()) {
                List<Consumer<Event>> callbacks = eventListeners.get(ent.getKey());
                if (callbacks != null) {
                    callbacks.remove(ent.getValue());
                }
            }
        }
        return this;
    }

    public List<Consumer<Event>> listeners(String eventName) {
        List<Consumer<Event>> callbacks = eventListeners.get(eventName);
        return callbacks == null ? Collections.<Consumer<Event>> emptyList()
                : Collections.unmodifiableList(callbacks);
    }

    /** Dispatch an event to the listeners attached to its name, returning the event. */
    public Event dispatch(Event event) {
        List<Consumer<Event>> callbacks = eventListeners.get(event.getName());
        if (callbacks == null || callbacks.isEmpty()) {
            return event;
        }
        if (++dispatchDepth > WARN_DISPATCH_DEPTH) {
            Log.warning("Event dispatch nested " + dispatchDepth + " deep, while dispatching " + event.getName());
        }
        try {
            // Copy the list, so that listeners can attach further listeners
            for (Consumer<Event> callback : new ArrayList<>(callbacks)) {
                callback.accept(event);
                if (event.isStopped()) {
                    break;
                }
            }
        } finally {
            dispatchDepth--;
        }
        return event;
    }

    /** Dispatch an event with the given name and subject. */
    public Event dispatch(String eventName, Object subject) {
        return dispatch(new Event(eventName, subject));
    }
}
