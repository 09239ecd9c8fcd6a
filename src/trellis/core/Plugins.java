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
package trellis.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import trellis.core.exception.MissingPluginException;
import trellis.util.Log;

/**
 * The registry of loaded plugins. A plugin is a named group of controllers, views, helpers and templates, whose
 * classes live under their own base package, and whose templates live under "plugins/[name]/" in the template root.
 */
public class Plugins {

    private static final Map<String, String> pluginToBasePackage = Collections
            .synchronizedMap(new LinkedHashMap<String, String>());

    /** Load a plugin, whose classes are found beneath basePackage. */
    public static void load(String name, String basePackage) {
        if (name == null || name.isEmpty() || name.indexOf('.') >= 0) {
            throw new IllegalArgumentException("Invalid plugin name: " + name);
        }
        String prev = pluginToBasePackage.put(name, basePackage);
        if (prev != null && !prev.equals(basePackage)) {
            Log.warning("Plugin " + name + " was reloaded with a new base package " + basePackage);
        } else if (prev == null) {
            Log.info("Loaded plugin " + name + " from package " + basePackage);
        }
    }

    public static void unload(String name) {
        pluginToBasePackage.remove(name);
    }

    public static void unloadAll() {
        pluginToBasePackage.clear();
    }

    public static boolean isLoaded(String name) {
        return name != null && pluginToBasePackage.containsKey(name);
    }

    public static Set<String> loaded() {
        synchronized (pluginToBasePackage) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(pluginToBasePackage.keySet()));
        }
    }

    /**
     * Get the base package of a loaded plugin.
     * 
     * @throws MissingPluginException
     *             if the plugin is not loaded.
     */
    public static String getBasePackage(String name) {
        String basePackage = pluginToBasePackage.get(name);
        if (basePackage == null) {
            throw new MissingPluginException(name);
        }
        return basePackage;
    }
}
