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
package trellis.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import trellis.core.App;
import trellis.util.Reflection;
import trellis.view.exception.MissingHelperException;
import trellis.view.helper.Helper;

/** The helpers loaded into a view, keyed by short name ("Html" for both "Html" and "Blog.Html"). */
public class HelperRegistry {

    private final View view;
    private final Map<String, Helper> loaded = new LinkedHashMap<>();

    public HelperRegistry(View view) {
        this.view = view;
    }

    /**
     * Load a helper by short or plugin-qualified name, e.g. "Html" resolves to the class HtmlHelper.
     * 
     * @throws MissingHelperException
     *             if the helper class cannot be found or instantiated.
     */
    public Helper load(String name) {
        String shortName = App.splitPluginName(name)[1];
        Helper helper = loaded.get(shortName);
        if (helper != null) {
            return helper;
        }
        Class<?> klass = App.className(name, "view.helper", "Helper");
        if (klass == null || !Helper.class.isAssignableFrom(klass)) {
            throw new MissingHelperException(name);
        }
        try {
            helper = Reflection.instantiateWithConstructor(klass.asSubclass(Helper.class),
                    new Class<?>[] { View.class }, view);
        } catch (InstantiationException e) {
            throw new MissingHelperException(name, e);
        }
        loaded.put(shortName, helper);
        return helper;
    }

    public boolean has(String shortName) {
        return loaded.containsKey(shortName);
    }

    public Helper get(String shortName) {
        return loaded.get(shortName);
    }

    public Set<String> loaded() {
        return Collections.unmodifiableSet(loaded.keySet());
    }
}
