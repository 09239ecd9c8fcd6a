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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named event, dispatched synchronously to listeners by an EventManager. The subject is the object the event
 * concerns (e.g. the controller for "Controller.startup"). Listeners can read and replace event data, set a result,
 * and stop the event from reaching later listeners.
 */
public class Event {

    private final String name;
    private final Object subject;
    private final Map<String, Object> data;
    private Object result;
    private boolean stopped;

    public Event(String name) {
        this(name, null, null);
    }

    public Event(String name, Object subject) {
        this(name, subject, null);
    }

    public Event(String name, Object subject, Map<String, ?> data) {
        this.name = name;
        this.subject = subject;
        this.data = data == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<String, Object>(data);
    }

    public String getName() {
        return name;
    }

    public Object getSubject() {
        return subject;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public Object getData(String key) {
        return data.get(key);
    }

    public Event setData(String key, Object value) {
        data.put(key, value);
        return this;
    }

    public Object getResult() {
        return result;
    }

    public Event setResult(Object result) {
        this.result = result;
        return this;
    }

    /** Stop the event from being passed to any further listeners. */
    public void stopPropagation() {
        this.stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public String toString() {
        return name;
    }
}
