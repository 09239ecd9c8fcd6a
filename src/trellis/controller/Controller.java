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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import trellis.event.Event;
import trellis.event.EventListener;
import trellis.event.EventManager;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.view.View;
import trellis.view.ViewBuilder;

/**
 * Handles a request: owns the request and response, collects view variables, and renders views. A controller
 * listens to its own lifecycle events, so subclasses can override beforeFilter, beforeRender and afterFilter;
 * components loaded with loadComponent listen to the same events.
 */
public class Controller implements EventListener {

    public static final String INITIALIZE = "Controller.initialize";
    public static final String STARTUP = "Controller.startup";
    public static final String BEFORE_RENDER = "Controller.beforeRender";
    public static final String SHUTDOWN = "Controller.shutdown";

    protected Request request;
    protected Response response;
    protected String name;
    protected String plugin;
    protected List<String> helpers = new ArrayList<>();

    protected final Map<String, Object> viewVars = new LinkedHashMap<>();
    private final EventManager eventManager = new EventManager();
    private final ComponentRegistry components;
    private ViewBuilder viewBuilder;

    // -----------------------------------------------------------------------------------------------------

    public Controller(Request request, Response response) {
        this.request = request == null ? Request.fromDefaults() : request;
        this.response = response == null ? new Response() : response;
        String className = getClass().getSimpleName();
        this.name = className.endsWith("Controller") ? className.substring(0, className.length() - 10) : className;
        this.plugin = this.request.getParam("plugin");
        this.components = new ComponentRegistry(this);
        eventManager.on(this);
        initialize();
    }

    /** Called at the end of the constructor. Subclasses load their components here. */
    public void initialize() {
    }

    @Override
    public Map<String, Consumer<Event>> implementedEvents() {
        Map<String, Consumer<Event>> events = new LinkedHashMap<>();
        events.put(INITIALIZE, this::beforeFilter);
        events.put(BEFORE_RENDER, this::beforeRender);
        events.put(SHUTDOWN, this::afterFilter);
        return events;
    }

    public void beforeFilter(Event event) {
    }

    public void beforeRender(Event event) {
    }

    public void afterFilter(Event event) {
    }

    // -----------------------------------------------------------------------------------------------------

    public Component loadComponent(String componentName) {
        return loadComponent(componentName, null);
    }

    public Component loadComponent(String componentName, Map<String, Object> config) {
        return components.load(componentName, config);
    }

    public ComponentRegistry components() {
        return components;
    }

    // -----------------------------------------------------------------------------------------------------

    /** Run the startup lifecycle: "Controller.initialize", then "Controller.startup". */
    public void startupProcess() {
        dispatchEvent(INITIALIZE);
        dispatchEvent(STARTUP);
    }

    /** Run the shutdown lifecycle: "Controller.shutdown". */
    public void shutdownProcess() {
        dispatchEvent(SHUTDOWN);
    }

    public Event dispatchEvent(String eventName) {
        return dispatchEvent(eventName, null);
    }

    public Event dispatchEvent(String eventName, Map<String, ?> data) {
        return eventManager.dispatch(new Event(eventName, this, data));
    }

    public EventManager getEventManager() {
        return eventManager;
    }

    // -----------------------------------------------------------------------------------------------------

    /** Render a template in the configured layout. */
    public Response render(String template) {
        return render(template, null);
    }

    /**
     * Render a template into the response body. Dispatches "Controller.beforeRender" first; a listener can stop the
     * event to skip rendering, or set a Response as the event result to replace the rendered response.
     */
    public Response render(String template, String layout) {
        ViewBuilder builder = viewBuilder();
        if (builder.getTemplatePath() == null) {
            builder.setTemplatePath(name);
        }

        Event event = dispatchEvent(BEFORE_RENDER);
        if (event.getResult() instanceof Response) {
            return (Response) event.getResult();
        }
        if (event.isStopped()) {
            return response;
        }

        View view = createView(null);
        String contents = view.render(template, layout);
        response.setContentType(view.getContentType()).setBody(contents);
        return response;
    }

    /**
     * Build a view from the view builder, with this controller's view variables, name, plugin and helpers. The
     * controller's helpers are only used if no helpers have been configured on the builder itself.
     * 
     * @param viewClass
     *            The view class to use, or null to use the class configured on the builder.
     */
    public View createView(String viewClass) {
        ViewBuilder builder = viewBuilder();
        if (viewClass != null) {
            builder.setClassName(viewClass);
        }
        if (builder.getName() == null) {
            builder.setName(name);
        }
        builder.setPlugin(plugin);
        if (builder.getHelpers().isEmpty() && !helpers.isEmpty()) {
            builder.setHelpers(helpers, false);
        }
        return builder.build(viewVars, request, response, eventManager);
    }

    public ViewBuilder viewBuilder() {
        if (viewBuilder == null) {
            viewBuilder = new ViewBuilder();
        }
        return viewBuilder;
    }

    // -----------------------------------------------------------------------------------------------------

    public Controller set(String varName, Object value) {
        viewVars.put(varName, value);
        return this;
    }

    public Controller set(Map<String, ?> vars) {
        viewVars.putAll(vars);
        return this;
    }

    public Object get(String varName) {
        return viewVars.get(varName);
    }

    public Map<String, Object> getViewVars() {
        return Collections.unmodifiableMap(viewVars);
    }

    // -----------------------------------------------------------------------------------------------------

    public Request getRequest() {
        return request;
    }

    public Response getResponse() {
        return response;
    }

    public void setResponse(Response response) {
        this.response = response;
    }

    public String getName() {
        return name;
    }

    public String getPlugin() {
        return plugin;
    }

    public void setPlugin(String plugin) {
        this.plugin = plugin;
    }

    public List<String> getHelpers() {
        return Collections.unmodifiableList(helpers);
    }

    public void setHelpers(List<String> helpers) {
        this.helpers = new ArrayList<>(helpers);
    }
}
