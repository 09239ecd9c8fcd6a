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

import trellis.server.config.TrellisProperties;
import trellis.util.Reflection;

/**
 * Resolves short class names to classes. A name of "Ajax" with type "view" and suffix "View" resolves to
 * "[app package].view.AjaxView" if that class exists, otherwise to "trellis.view.AjaxView". A plugin-qualified
 * name "Blog.Feed" resolves to "[Blog base package].view.FeedView", and only if the Blog plugin is loaded.
 */
public class App {

    /** Package that holds the framework's own classes. */
    public static final String FRAMEWORK_PACKAGE = "trellis";

    /**
     * Return the class for a short or plugin-qualified name, or null if no such class exists.
     * 
     * @param name
     *            The short name, e.g. "Error", or a plugin-qualified name, e.g. "Blog.Error".
     * @param type
     *            The sub-package relative to the base package, e.g. "controller" or "view.helper".
     * @param suffix
     *            The suffix to append to the short name, e.g. "Controller", or "" for none.
     */
    public static Class<?> className(String name, String type, String suffix) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        if (name.indexOf('.') >= 0 && !name.startsWith(".")) {
            String[] pluginAndName = splitPluginName(name);
            if (!Plugins.isLoaded(pluginAndName[0])) {
                return null;
            }
            return Reflection.classForNameOrNull(
                    fullName(Plugins.getBasePackage(pluginAndName[0]), type, pluginAndName[1], suffix));
        }
        Class<?> klass = Reflection.classForNameOrNull(fullName(TrellisProperties.APP_PACKAGE, type, name, suffix));
        if (klass == null) {
            klass = Reflection.classForNameOrNull(fullName(FRAMEWORK_PACKAGE, type, name, suffix));
        }
        return klass;
    }

    /** Split "Plugin.Name" into { "Plugin", "Name" }, or "Name" into { null, "Name" }. */
    public static String[] splitPluginName(String name) {
        int dotIdx = name.lastIndexOf('.');
        if (dotIdx < 0) {
            return new String[] { null, name };
        }
        return new String[] { name.substring(0, dotIdx), name.substring(dotIdx + 1) };
    }

    private static String fullName(String basePackage, String type, String name, String suffix) {
        return basePackage + "." + type + "." + name + suffix;
    }
}
