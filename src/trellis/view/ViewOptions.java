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
import java.util.List;
import java.util.Map;

/**
 * The parameters a view is constructed with: the named configuration fields, the view variables, and any extra
 * options, all in one map. Extra options never replace a named field (see {@link ViewBuilder#build}).
 */
public class ViewOptions {

    public static final String NAME = "name";
    public static final String TEMPLATE_PATH = "templatePath";
    public static final String TEMPLATE = "template";
    public static final String PLUGIN = "plugin";
    public static final String THEME = "theme";
    public static final String LAYOUT = "layout";
    public static final String AUTO_LAYOUT = "autoLayout";
    public static final String LAYOUT_PATH = "layoutPath";
    public static final String HELPERS = "helpers";
    public static final String VIEW_VARS = "viewVars";

    private final Map<String, Object> data;

    public ViewOptions(Map<String, Object> data) {
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public String getName() {
        return (String) data.get(NAME);
    }

    public String getTemplatePath() {
        return (String) data.get(TEMPLATE_PATH);
    }

    public String getTemplate() {
        return (String) data.get(TEMPLATE);
    }

    public String getPlugin() {
        return (String) data.get(PLUGIN);
    }

    public String getTheme() {
        return (String) data.get(THEME);
    }

    public String getLayout() {
        return (String) data.get(LAYOUT);
    }

    public boolean isAutoLayout() {
        Object autoLayout = data.get(AUTO_LAYOUT);
        return autoLayout == null || Boolean.TRUE.equals(autoLayout);
    }

    public String getLayoutPath() {
        return (String) data.get(LAYOUT_PATH);
    }

    @SuppressWarnings("unchecked")
    public List<String> getHelpers() {
        List<String> helpers = (List<String>) data.get(HELPERS);
        return helpers == null ? Collections.<String> emptyList() : helpers;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getViewVars() {
        Map<String, Object> viewVars = (Map<String, Object>) data.get(VIEW_VARS);
        return viewVars == null ? Collections.<String, Object> emptyMap() : viewVars;
    }

    /** Get a named field or an extra option. */
    public Object get(String key) {
        return data.get(key);
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    @Override
    public String toString() {
        return data.toString();
    }
}
