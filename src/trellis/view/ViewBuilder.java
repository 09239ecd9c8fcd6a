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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import trellis.core.App;
import trellis.event.EventManager;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.util.Reflection;
import trellis.view.exception.MissingViewException;

/**
 * Accumulates the configuration of a view (template, layout, plugin, theme, helpers and so on) and builds the view
 * when it is needed. Setters return the builder so that calls can be chained:
 * 
 * <pre>
 * View view = new ViewBuilder().setTemplatePath("Posts").setLayout("admin").addHelper("Form")
 *         .build(vars, request, response, eventManager);
 * </pre>
 */
public class ViewBuilder {

    private String templatePath;
    private String template;
    private String plugin;
    private String theme;
    private String layout;
    private boolean autoLayout = true;
    private String layoutPath;
    private String name;
    private String className;
    private Map<String, Object> options = new LinkedHashMap<>();
    private List<String> helpers = new ArrayList<>();

    // -----------------------------------------------------------------------------------------------------

    public String getTemplatePath() {
        return templatePath;
    }

    /** Set the directory, relative to the template root, that templates are loaded from. */
    public ViewBuilder setTemplatePath(String templatePath) {
        this.templatePath = templatePath;
        return this;
    }

    public String getLayoutPath() {
        return layoutPath;
    }

    /** Set the directory, relative to the layout directory, that layouts are loaded from. */
    public ViewBuilder setLayoutPath(String layoutPath) {
        this.layoutPath = layoutPath;
        return this;
    }

    public boolean isAutoLayoutEnabled() {
        return autoLayout;
    }

    /** Turn wrapping of the rendered template in its layout on or off. On by default. */
    public ViewBuilder enableAutoLayout(boolean autoLayout) {
        this.autoLayout = autoLayout;
        return this;
    }

    public String getPlugin() {
        return plugin;
    }

    public ViewBuilder setPlugin(String plugin) {
        this.plugin = plugin;
        return this;
    }

    public String getTheme() {
        return theme;
    }

    public ViewBuilder setTheme(String theme) {
        this.theme = theme;
        return this;
    }

    public String getTemplate() {
        return template;
    }

    public ViewBuilder setTemplate(String template) {
        this.template = template;
        return this;
    }

    public String getLayout() {
        return layout;
    }

    public ViewBuilder setLayout(String layout) {
        this.layout = layout;
        return this;
    }

    public String getName() {
        return name;
    }

    public ViewBuilder setName(String name) {
        this.name = name;
        return this;
    }

    public String getClassName() {
        return className;
    }

    /** Set the view class, as a short name ("Json") or a plugin-qualified name ("Blog.Feed"). */
    public ViewBuilder setClassName(String className) {
        this.className = className;
        return this;
    }

    // -----------------------------------------------------------------------------------------------------

    public List<String> getHelpers() {
        return Collections.unmodifiableList(helpers);
    }

    /** Add helpers to the helpers already configured. */
    public ViewBuilder setHelpers(List<String> helpers) {
        return setHelpers(helpers, true);
    }

    /**
     * Set the helpers to load into the view.
     * 
     * @param merge
     *            If true, the helpers are appended to those already configured, skipping any already present. If
     *            false, they replace the configured helpers.
     */
    public ViewBuilder setHelpers(List<String> helpers, boolean merge) {
        if (!merge) {
            this.helpers = new ArrayList<>();
        }
        for (String helper : helpers) {
            addHelper(helper);
        }
        return this;
    }

    public ViewBuilder addHelper(String helper) {
        if (!helpers.contains(helper)) {
            helpers.add(helper);
        }
        return this;
    }

    public Map<String, Object> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    /** Add extra view options, replacing the values of any options already set under the same keys. */
    public ViewBuilder setOptions(Map<String, ?> options) {
        return setOptions(options, true);
    }

    /**
     * Set extra options that are passed to the view constructor alongside the named fields.
     * 
     * @param merge
     *            If true, the options are merged into those already set, new values winning. If false, they replace
     *            all options already set.
     */
    public ViewBuilder setOptions(Map<String, ?> options, boolean merge) {
        if (!merge) {
            this.options = new LinkedHashMap<>();
        }
        this.options.putAll(options);
        return this;
    }

    // -----------------------------------------------------------------------------------------------------

    /** Copy all configuration from another builder into this one. */
    public ViewBuilder createFrom(ViewBuilder other) {
        this.templatePath = other.templatePath;
        this.template = other.template;
        this.plugin = other.plugin;
        this.theme = other.theme;
        this.layout = other.layout;
        this.autoLayout = other.autoLayout;
        this.layoutPath = other.layoutPath;
        this.name = other.name;
        this.className = other.className;
        this.options = new LinkedHashMap<>(other.options);
        this.helpers = new ArrayList<>(other.helpers);
        return this;
    }

    /**
     * Resolve the configured class name to a view class. A null class name or "View" resolves to the base View
     * class (or an application class called View, if there is one).
     * 
     * @throws MissingViewException
     *             if the name does not resolve to a subclass of View.
     */
    public Class<? extends View> resolveViewClass() {
        Class<?> klass;
        if (className == null || className.equals("View")) {
            klass = App.className("View", "view", "");
        } else {
            klass = App.className(className, "view", "View");
        }
        if (klass == null || !View.class.isAssignableFrom(klass)) {
            throw new MissingViewException(className == null ? "View" : className);
        }
        return klass.asSubclass(View.class);
    }

    /**
     * Assemble the parameters the view is constructed with. Extra options are added after the named fields, and an
     * option is dropped if a named field has the same key, even if that field's value is null.
     */
    public ViewOptions toViewOptions(Map<String, Object> vars) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ViewOptions.NAME, name);
        data.put(ViewOptions.TEMPLATE_PATH, templatePath);
        data.put(ViewOptions.TEMPLATE, template);
        data.put(ViewOptions.PLUGIN, plugin);
        data.put(ViewOptions.THEME, theme);
        data.put(ViewOptions.LAYOUT, layout);
        data.put(ViewOptions.AUTO_LAYOUT, autoLayout);
        data.put(ViewOptions.LAYOUT_PATH, layoutPath);
        data.put(ViewOptions.HELPERS, new ArrayList<>(helpers));
        data.put(ViewOptions.VIEW_VARS, vars == null ? new LinkedHashMap<String, Object>()
                : new LinkedHashMap<String, Object>(vars));
        for (Entry<String, Object> ent : options.entrySet()) {
            if (!data.containsKey(ent.getKey())) {
                data.put(ent.getKey(), ent.getValue());
            }
        }
        return new ViewOptions(data);
    }

    /**
     * Build a view using the configured class and options.
     * 
     * @param vars
     *            The view variables, may be null.
     * @param request
     *            The request being handled, may be null.
     * @param response
     *            The response being built, may be null.
     * @param eventManager
     *            The event manager the view dispatches its render events through, may be null.
     * @throws MissingViewException
     *             if the view class cannot be resolved or instantiated.
     */
    public View build(Map<String, Object> vars, Request request, Response response, EventManager eventManager) {
        Class<? extends View> viewClass = resolveViewClass();
        ViewOptions viewOptions = toViewOptions(vars);
        try {
            return Reflection.instantiateWithConstructor(viewClass,
                    new Class<?>[] { Request.class, Response.class, EventManager.class, ViewOptions.class }, //
                    request, response, eventManager, viewOptions);
        } catch (InstantiationException e) {
            throw new MissingViewException(viewClass.getName(), e);
        }
    }

    public View build(Map<String, Object> vars) {
        return build(vars, null, null, null);
    }
}
