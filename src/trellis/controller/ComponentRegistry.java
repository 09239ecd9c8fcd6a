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
import java.util.Set;

import trellis.controller.exception.MissingComponentException;
import trellis.core.App;
import trellis.util.Reflection;

/** The components loaded by a controller, keyed by short name. */
public class ComponentRegistry {

    private final Controller controller;
    private final Map<String, Component> loaded = new LinkedHashMap<>();

    public ComponentRegistry(Controller controller) {
        this.controller = controller;
    }

    public Controller getController() {
        return controller;
    }

    /**
     * Load a component by short or plugin-qualified name, and attach it to the controller's events. Loading a
     * component that is already loaded returns the loaded instance.
     * 
     * @throws MissingComponentException
     *             if the component class cannot be found or instantiated.
     */
    public Component load(String name, Map<String, Object> config) {
        String shortName = App.splitPluginName(name)[1];
        Component component = loaded.get(shortName);
        if (component != null) {
            return component;
        }
        Class<?> klass = App.className(name, "controller.component", "Component");
        if (klass == null || !Component.class.isAssignableFrom(klass)) {
            throw new MissingComponentException(name);
        }
        try {
            component = Reflection.instantiateWithConstructor(klass.asSubclass(Component.class),
                    new Class<?>[] { ComponentRegistry.class, Map.class }, this, config);
        } catch (InstantiationException e) {
            throw new MissingComponentException(name, e);
        }
        loaded.put(shortName, component);
        controller.getEventManager().on(component);
        return component;
    }

    public boolean has(String shortName) {
        return loaded.containsKey(shortName);
    }

    public Component get(String shortName) {
        return loaded.get(shortName);
    }

    public Set<String> loaded() {
        return Collections.unmodifiableSet(loaded.keySet());
    }
}
