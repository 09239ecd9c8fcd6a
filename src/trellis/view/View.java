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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import trellis.core.Plugins;
import trellis.core.exception.MissingPluginException;
import trellis.event.Event;
import trellis.event.EventManager;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.server.config.TrellisProperties;
import trellis.util.Log;
import trellis.util.StringUtils;
import trellis.util.WebUtils;
import trellis.view.exception.MissingLayoutException;
import trellis.view.exception.MissingTemplateException;
import trellis.view.helper.Helper;

/**
 * Renders HTML templates loaded from the classpath, optionally wrapped in a layout.
 * 
 * Templates are found under the template root (the "templates.root" property) at "[templatePath]/[template].html".
 * If a theme is set, "themes/[theme]/" is searched first; if a plugin is set, "plugins/[plugin]/" is searched
 * next; the application's own templates are searched last. Layouts are found the same way, at
 * "Layout/[layoutPath]/[layout].html".
 * 
 * In a template, "${name}" is replaced by the HTML-escaped value of the view variable "name" (or by nothing if there
 * is no such variable), "${name.key}" by the escaped value for "key" if the variable is a Map, and "${Html.charset}"
 * by the fragment "charset" of the loaded helper "Html". A layout inserts the rendered template with "${content}".
 */
public class View {

    /** Pattern for template parameters, of the form "${name}" or "${name.key}" */
    public static final Pattern TEMPLATE_PARAM_PATTERN = Pattern
            .compile("\\$\\{([a-zA-Z_][a-zA-Z0-9_]*)(?:\\.([a-zA-Z_][a-zA-Z0-9_]*))?\\}");

    public static final String TEMPLATE_EXTENSION = ".html";
    public static final String LAYOUT_DIR = "Layout";
    public static final String THEMES_DIR = "themes";
    public static final String PLUGINS_DIR = "plugins";

    public static final String BEFORE_RENDER = "View.beforeRender";
    public static final String AFTER_RENDER = "View.afterRender";
    public static final String BEFORE_LAYOUT = "View.beforeLayout";
    public static final String AFTER_LAYOUT = "View.afterLayout";

    protected final Request request;
    protected final Response response;
    protected final EventManager eventManager;

    protected String name;
    protected String templatePath;
    protected String template;
    protected String plugin;
    protected String theme;
    protected String layout = "default";
    protected boolean autoLayout;
    protected String layoutPath;
    protected final Map<String, Object> viewVars;
    protected final List<String> helperNames;
    protected final ViewOptions options;

    private HelperRegistry helpers;

    // -----------------------------------------------------------------------------------------------------

    public View(Request request, Response response, EventManager eventManager, ViewOptions options) {
        this.request = request;
        this.response = response;
        this.eventManager = eventManager == null ? new EventManager() : eventManager;
        this.options = options;

        this.name = options.getName();
        this.templatePath = options.getTemplatePath();
        this.template = options.getTemplate();
        this.plugin = options.getPlugin();
        this.theme = options.getTheme();
        if (options.getLayout() != null) {
            this.layout = options.getLayout();
        }
        this.autoLayout = options.isAutoLayout();
        this.layoutPath = options.getLayoutPath();
        this.viewVars = new LinkedHashMap<>(options.getViewVars());
        this.helperNames = new ArrayList<>(options.getHelpers());
    }

    // -----------------------------------------------------------------------------------------------------

    /** Render the configured template in the configured layout. */
    public String render() {
        return render(null, null);
    }

    /**
     * Render a template, then wrap it in a layout if autoLayout is on.
     * 
     * @param template
     *            The template to render, or null to render the configured template.
     * @param layout
     *            The layout to use, or null to use the configured layout.
     * @throws MissingPluginException
     *             if the view belongs to a plugin that is not loaded.
     * @throws MissingTemplateException
     *             if the template cannot be found.
     * @throws MissingLayoutException
     *             if the layout cannot be found.
     */
    public String render(String template, String layout) {
        if (template != null) {
            this.template = template;
        }
        if (layout != null) {
            this.layout = layout;
        }
        if (this.template == null || this.template.isEmpty()) {
            throw new IllegalStateException("No template set for view " + name);
        }
        if (plugin != null && !Plugins.isLoaded(plugin)) {
            throw new MissingPluginException(plugin);
        }
        helpers();

        String templateFile = templateFile(this.template);
        Map<String, Object> fileData = Collections.<String, Object> singletonMap("file", templateFile);
        eventManager.dispatch(new Event(BEFORE_RENDER, this, fileData));
        String content = evaluate(loadTemplate(templateFile, false), null);
        eventManager.dispatch(new Event(AFTER_RENDER, this, fileData));

        if (autoLayout && !StringUtils.isEmpty(this.layout)) {
            content = renderLayout(content);
        }
        return content;
    }

    protected String renderLayout(String content) {
        String layoutFile = layoutFile(this.layout);
        Map<String, Object> fileData = Collections.<String, Object> singletonMap("file", layoutFile);
        eventManager.dispatch(new Event(BEFORE_LAYOUT, this, fileData));
        String html = evaluate(loadTemplate(layoutFile, true), content);
        eventManager.dispatch(new Event(AFTER_LAYOUT, this, fileData));

        if (TrellisProperties.PRETTY_PRINT_HTML) {
            Document doc = Jsoup.parse(html);
            doc.outputSettings().prettyPrint(true).charset("UTF-8");
            html = doc.outerHtml();
        }
        return html;
    }

    /** Substitute parameters into a template. If content is non-null, it replaces "${content}" unescaped. */
    protected String evaluate(String templateSrc, String content) {
        StringBuilder buf = new StringBuilder(templateSrc.length() * 2);
        Matcher matcher = TEMPLATE_PARAM_PATTERN.matcher(templateSrc);
        int prevEnd = 0;
        while (matcher.find()) {
            buf.append(templateSrc, prevEnd, matcher.start());
            prevEnd = matcher.end();
            String paramName = matcher.group(1);
            String key = matcher.group(2);

            if (key != null && helpers().has(paramName)) {
                // Helper output is already HTML
                buf.append(helpers().get(paramName).renderFragment(key));
            } else if (key == null && content != null && paramName.equals("content")) {
                buf.append(content);
            } else {
                Object value = viewVars.get(paramName);
                if (key != null) {
                    value = value instanceof Map ? ((Map<?, ?>) value).get(key) : null;
                }
                if (value != null) {
                    // Values that are already escaped, e.g. the error page's url, are not escaped twice
                    WebUtils.encodeForHTML(value.toString(), WebUtils.EscapeAmpersand.IF_NOT_VALID_ENTITY,
                            /* preserveNewline = */true, buf);
                }
            }
        }
        buf.append(templateSrc, prevEnd, templateSrc.length());
        return buf.toString();
    }

    // -----------------------------------------------------------------------------------------------------

    /** The path of a template relative to the template root, e.g. "Error/error500.html". */
    protected String templateFile(String templateName) {
        return StringUtils.isEmpty(templatePath) ? templateName + TEMPLATE_EXTENSION
                : templatePath + "/" + templateName + TEMPLATE_EXTENSION;
    }

    /** The path of a layout relative to the template root, e.g. "Layout/error.html". */
    protected String layoutFile(String layoutName) {
        return StringUtils.isEmpty(layoutPath) ? LAYOUT_DIR + "/" + layoutName + TEMPLATE_EXTENSION
                : LAYOUT_DIR + "/" + layoutPath + "/" + layoutName + TEMPLATE_EXTENSION;
    }

    /** The directories that are searched for templates, relative to the template root, in search order. */
    protected List<String> templateRoots() {
        List<String> roots = new ArrayList<>();
        if (!StringUtils.isEmpty(theme)) {
            roots.add(THEMES_DIR + "/" + theme + "/");
        }
        if (!StringUtils.isEmpty(plugin)) {
            roots.add(PLUGINS_DIR + "/" + plugin + "/");
        }
        roots.add("");
        return roots;
    }

    /** Load a template or layout from the classpath. */
    protected String loadTemplate(String file, boolean isLayout) {
        List<String> roots = templateRoots();
        ClassLoader classLoader = View.class.getClassLoader();
        for (String root : roots) {
            String resourcePath = TrellisProperties.TEMPLATES_ROOT + "/" + root + file;
            try (InputStream inputStream = classLoader.getResourceAsStream(resourcePath)) {
                if (inputStream != null) {
                    Log.fine("Loading template " + resourcePath);
                    return StringUtils.readWholeFile(inputStream);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read template " + resourcePath, e);
            }
        }
        List<String> paths = new ArrayList<>();
        for (String root : roots) {
            paths.add(TrellisProperties.TEMPLATES_ROOT + "/" + root);
        }
        if (isLayout) {
            throw new MissingLayoutException(file, paths);
        } else {
            throw new MissingTemplateException(file, paths);
        }
    }

    // -----------------------------------------------------------------------------------------------------

    /** Get the helpers of this view, loading them on first use. */
    public HelperRegistry helpers() {
        if (helpers == null) {
            HelperRegistry registry = new HelperRegistry(this);
            for (String helperName : helperNames) {
                registry.load(helperName);
            }
            helpers = registry;
        }
        return helpers;
    }

    public Helper getHelper(String helperName) {
        return helpers().get(helperName);
    }

    // -----------------------------------------------------------------------------------------------------

    public View set(String varName, Object value) {
        viewVars.put(varName, value);
        return this;
    }

    public View set(Map<String, ?> vars) {
        viewVars.putAll(vars);
        return this;
    }

    public Object get(String varName) {
        return viewVars.get(varName);
    }

    public Map<String, Object> getVars() {
        return Collections.unmodifiableMap(viewVars);
    }

    /** The content type of the rendered output, as accepted by {@link Response#setContentType(String)}. */
    public String getContentType() {
        return "html";
    }

    // -----------------------------------------------------------------------------------------------------

    public Request getRequest() {
        return request;
    }

    public Response getResponse() {
        return response;
    }

    public EventManager getEventManager() {
        return eventManager;
    }

    public String getName() {
        return name;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public String getTemplate() {
        return template;
    }

    public String getPlugin() {
        return plugin;
    }

    public String getTheme() {
        return theme;
    }

    public String getLayout() {
        return layout;
    }

    public boolean isAutoLayout() {
        return autoLayout;
    }

    public String getLayoutPath() {
        return layoutPath;
    }

    public List<String> getHelperNames() {
        return Collections.unmodifiableList(helperNames);
    }

    /** Get a named field or an extra option that this view was constructed with. */
    public Object getOption(String key) {
        return options.get(key);
    }
}
