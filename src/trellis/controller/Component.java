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
package trellis.controller;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import trellis.event.Event;
import trellis.event.EventListener;

/**
 * A reusable piece of controller logic. A component listens to the lifecycle events of the controller that loaded
 * it; subclasses override the callbacks they need. Subclasses need a public constructor taking the
 * ComponentRegistry and a configuration Map.
 */
public abstract class Component implements EventListener {

    protected final ComponentRegistry registry;
    protected final Map<String, Object> config;

    public Component(ComponentRegistry registry, Map<String, Object> config) {
        this.registry = registry;
        this.config = config == null ? Collections.<String, Object> emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public Controller getController() {
        return registry.getController();
    }

    /** The short name of this component, e.g. "RequestHandler" for RequestHandlerComponent. */
    public String getName() {
        String className = getClass().getSimpleName();
        return className.endsWith("Component") ? className.substring(0, className.length() - 9) : className;
    }

    @Override
    public Map<String, Consumer<Event>> implementedEvents() {
        Map<String, Consumer<Event>> events = new LinkedHashMap<>();
        events.put(Controller.INITIALIZE, this::beforeFilter);
        events.put(Controller.STARTUP, this::startup);
        events.put(Controller.BEFORE_RENDER, this::beforeRender);
        events.put(Controller.SHUTDOWN, this::shutdown);
        return events;
    }

    public void beforeFilter(Event event) {
    }

    public void startup(Event event) {
    }

    public void beforeRender(Event event) {
    }

    public void shutdown(Event event) {
    }
}
