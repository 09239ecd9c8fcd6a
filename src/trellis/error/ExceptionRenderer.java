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
package trellis.error;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import trellis.controller.Component;
import trellis.controller.Controller;
import trellis.core.App;
import trellis.core.exception.MissingPluginException;
import trellis.core.exception.TrellisException;
import trellis.event.Event;
import trellis.event.EventManager;
import trellis.http.exception.HttpException;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.routing.Dispatcher;
import trellis.routing.DispatcherFactory;
import trellis.routing.DispatcherFilter;
import trellis.routing.Router;
import trellis.server.config.TrellisProperties;
import trellis.util.Log;
import trellis.util.Reflection;
import trellis.util.StringUtils;
import trellis.util.WebUtils;
import trellis.view.View;
import trellis.view.ViewBuilder;
import trellis.view.exception.MissingTemplateException;

/**
 * Renders the response for an exception, using an "Error" controller.
 * 
 * <p>
 * The exception's code is used as the status code if it is in the range [400, 506), otherwise 500 is used. In
 * production mode, exceptions that are not HTTP exceptions render the error400 or error500 template with a generic
 * message, so that no internal details leak to the client. In debug mode, the template is named after the exception
 * type (MissingWidgetException renders "missingWidget"), and the stack trace and exception attributes are
 * available to the template.
 * 
 * <p>
 * If the template cannot be rendered, rendering falls back to the error500 template, then to a minimal view that
 * uses only the Form and Html helpers and no components.
 * 
 * <p>
 * Subclasses can register custom handlers for exception types in their constructor, via {@link #getHandlers()}.
 */
public class ExceptionRenderer {

    public static final String GENERIC_NOT_FOUND_MESSAGE = "Not Found";
    public static final String GENERIC_ERROR_MESSAGE = "An Internal Error Has Occurred.";

    public static final String ERROR_400_TEMPLATE = "error400";
    public static final String ERROR_500_TEMPLATE = "error500";
    public static final String DATABASE_ERROR_TEMPLATE = "pdo_error";
    public static final String ERROR_LAYOUT = "error";

    /** The helpers used by the safe render. */
    public static final List<String> SAFE_HELPERS = Arrays.asList("Form", "Html");

    protected final Throwable error;
    protected final Request request;
    protected final Router router;
    protected final Controller controller;

    protected String template;
    protected String method;

    private final ExceptionHandlerRegistry handlers = new ExceptionHandlerRegistry();

    // -----------------------------------------------------------------------------------------------------

    public ExceptionRenderer(Throwable error) {
        this(error, null, null);
    }

    public ExceptionRenderer(Throwable error, Request request) {
        this(error, request, null);
    }

    /**
     * @param request
     *            The request that caused the error, or null to use the router's current request.
     * @param router
     *            The router that dispatched the request, or null if the request is not known to a router.
     */
    public ExceptionRenderer(Throwable error, Request request, Router router) {
        this.error = error;
        this.request = request;
        this.router = router;
        this.controller = getController();
    }

    // -----------------------------------------------------------------------------------------------------

    /** Returns the wrapped Error if the exception is a FatalErrorException, otherwise the exception itself. */
    protected Throwable unwrap(Throwable exception) {
        return exception instanceof FatalErrorException ? ((FatalErrorException) exception).getError() : exception;
    }

    /**
     * Get the controller to render the error with. Uses the application's ErrorController if there is one, otherwise
     * the framework's. If the error controller cannot be constructed, a bare Controller is used.
     */
    protected Controller getController() {
        Request req = request;
        if (req == null && router != null) {
            req = router.getRequest();
        }
        if (req == null) {
            req = Request.fromDefaults();
        }
        Response response = new Response();

        Controller errorController = null;
        boolean startedUp = false;
        try {
            Class<?> klass = App.className("Error", "controller", "Controller");
            if (klass == null || !Controller.class.isAssignableFrom(klass)) {
                throw new IllegalStateException("No error controller class could be found");
            }
            errorController = Reflection.instantiateWithConstructor(klass.asSubclass(Controller.class),
                    new Class<?>[] { Request.class, Response.class }, req, response);
            errorController.startupProcess();
            startedUp = true;
        } catch (InstantiationException | RuntimeException | LinkageError e) {
            Log.warning("Could not start up error controller: " + e);
        }

        // Startup may have failed in a listener other than RequestHandler, so give RequestHandler another chance
        // to parse the request body
        if (!startedUp && errorController != null && errorController.components().has("RequestHandler")) {
            try {
                Component requestHandler = errorController.components().get("RequestHandler");
                requestHandler.startup(new Event(Controller.STARTUP, errorController));
            } catch (RuntimeException e) {
                Log.fine("Ignoring RequestHandler startup failure in error controller: " + e);
            }
        }
        if (errorController == null) {
            errorController = new Controller(req, response);
        }
        return errorController;
    }

    // -----------------------------------------------------------------------------------------------------

    /** Render the response for the exception. */
    public Response render() {
        Throwable exception = error;
        int code = code(exception);
        String methodName = method(exception);
        String templateName = template(exception, methodName, code);
        Throwable unwrapped = unwrap(exception);

        boolean isDebug = TrellisProperties.DEBUG;
        if (isDebug || exception instanceof HttpException) {
            CustomErrorHandler<Throwable> handler = handlers.find(unwrapped.getClass());
            if (handler != null) {
                return customMethod(handler, unwrapped, code);
            }
        }

        String message = message(exception, code);
        String url = controller.getRequest().getRequestTarget();
        Response response = controller.getResponse();

        if (exception instanceof TrellisException) {
            for (Map.Entry<String, String> ent : ((TrellisException) exception).getResponseHeaders().entrySet()) {
                response.setHeader(ent.getKey(), ent.getValue());
            }
        }
        response.setStatus(code);

        Map<String, Object> viewVars = new LinkedHashMap<>();
        viewVars.put("message", message);
        viewVars.put("url", WebUtils.encodeForHTML(url));
        viewVars.put("error", unwrapped);
        viewVars.put("code", code);
        List<String> serialize = new ArrayList<>(Arrays.asList("message", "url", "code"));
        if (isDebug) {
            viewVars.put("trace", Debugger.formatTrace(unwrapped));
            String file = Debugger.file(unwrapped);
            Integer line = Debugger.line(unwrapped);
            viewVars.put("file", file == null ? "null" : file);
            viewVars.put("line", line == null ? "null" : line);
            serialize.add("file");
            serialize.add("line");
        }
        viewVars.put("_serialize", serialize);
        controller.set(viewVars);

        if (isDebug && unwrapped instanceof TrellisException) {
            controller.set(((TrellisException) unwrapped).getAttributes());
        }
        controller.setResponse(response);

        return outputMessage(templateName);
    }

    /**
     * Render the error with a custom handler, then run the shutdown events. The controller's response carries the
     * error status before the handler runs, so a handler returning only a body still responds with the error code.
     */
    protected Response customMethod(CustomErrorHandler<Throwable> handler, Throwable exception, int code) {
        controller.getResponse().setStatus(code);
        Object result = handler.handle(this, exception);
        shutdown();
        if (result instanceof Response) {
            return (Response) result;
        }
        Response response = controller.getResponse();
        if (result != null) {
            response.setBody(result.toString());
        }
        return response;
    }

    // -----------------------------------------------------------------------------------------------------

    /**
     * Get the handler method name for the exception: the simple class name without the "Exception" suffix, as a
     * lower camel case identifier. Returns "error500" if nothing is left.
     */
    protected String method(Throwable exception) {
        String baseClass = StringUtils.stripExceptionSuffix(unwrap(exception).getClass().getSimpleName());
        String methodName = StringUtils.variableName(baseClass);
        method = methodName.isEmpty() ? ERROR_500_TEMPLATE : methodName;
        return method;
    }

    /** Get the message to show for the exception. Production mode hides the message of non-HTTP exceptions. */
    protected String message(Throwable exception, int code) {
        Throwable unwrapped = unwrap(exception);
        String message = unwrapped.getMessage() == null ? "" : unwrapped.getMessage();
        if (!TrellisProperties.DEBUG && !(unwrapped instanceof HttpException)) {
            message = code < 500 ? GENERIC_NOT_FOUND_MESSAGE : GENERIC_ERROR_MESSAGE;
        }
        return message;
    }

    /** Get the name of the template to render the exception with. */
    protected String template(Throwable exception, String methodName, int code) {
        Throwable unwrapped = unwrap(exception);
        if (unwrapped instanceof SQLException) {
            template = DATABASE_ERROR_TEMPLATE;
        } else if (!TrellisProperties.DEBUG || unwrapped instanceof HttpException) {
            template = code < 500 ? ERROR_400_TEMPLATE : ERROR_500_TEMPLATE;
        } else {
            template = StringUtils.isEmpty(methodName) ? ERROR_500_TEMPLATE : methodName;
        }
        return template;
    }

    /** Get the status code for the exception, in the range [400, 506). Defaults to 500. */
    protected int code(Throwable exception) {
        Throwable unwrapped = unwrap(exception);
        int errorCode = unwrapped instanceof TrellisException ? ((TrellisException) unwrapped).getCode() : 0;
        return errorCode >= 400 && errorCode < 506 ? errorCode : TrellisException.DEFAULT_CODE;
    }

    // -----------------------------------------------------------------------------------------------------

    /** Render the template through the controller, falling back to safer renders on failure. */
    protected Response outputMessage(String templateName) {
        try {
            controller.render(templateName);
            return shutdown();

        } catch (MissingTemplateException e) {
            String file = e.getFile();
            if ((file != null && file.contains(ERROR_500_TEMPLATE)) || ERROR_500_TEMPLATE.equals(templateName)) {
                Log.warning("Error template missing, using safe render: " + e.getMessage());
                return outputMessageSafe(ERROR_500_TEMPLATE);
            }
            Log.fine("Error template missing, retrying with " + ERROR_500_TEMPLATE + ": " + e.getMessage());
            template = ERROR_500_TEMPLATE;
            return outputMessage(ERROR_500_TEMPLATE);

        } catch (MissingPluginException e) {
            String plugin = e.getPlugin();
            if (plugin != null && plugin.equals(controller.getPlugin())) {
                controller.setPlugin(null);
            }
            Log.warning("Plugin missing while rendering error, using safe render: " + e.getMessage());
            return outputMessageSafe(ERROR_500_TEMPLATE);

        } catch (RuntimeException e) {
            Log.exceptionWithoutCallerRef("Exception while rendering error, using safe render", e);
            return outputMessageSafe(ERROR_500_TEMPLATE);
        }
    }

    /**
     * Render the template with only the basic helpers, no layout path and no component callbacks. Exceptions thrown
     * here are not caught.
     */
    protected Response outputMessageSafe(String templateName) {
        controller.setHelpers(SAFE_HELPERS);
        ViewBuilder builder = controller.viewBuilder();
        builder.setHelpers(SAFE_HELPERS, false).setLayoutPath("").setTemplatePath("Error");
        View view = controller.createView("View");

        Response response = controller.getResponse();
        response.setContentType("html").setBody(view.render(templateName, ERROR_LAYOUT));
        controller.setResponse(response);
        return response;
    }

    /** Run the controller's shutdown events, then the dispatcher's afterDispatch event. */
    protected Response shutdown() {
        controller.dispatchEvent(Controller.SHUTDOWN);
        Dispatcher dispatcher = DispatcherFactory.create();
        EventManager eventManager = dispatcher.getEventManager();
        for (DispatcherFilter filter : dispatcher.filters()) {
            eventManager.on(filter);
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("request", controller.getRequest());
        args.put("response", controller.getResponse());
        Event result = dispatcher.dispatchEvent(DispatcherFilter.AFTER_DISPATCH, args);
        return (Response) result.getData("response");
    }

    // -----------------------------------------------------------------------------------------------------

    public ExceptionHandlerRegistry getHandlers() {
        return handlers;
    }

    public Throwable getError() {
        return error;
    }

    public Controller getErrorController() {
        return controller;
    }

    public String getTemplate() {
        return template;
    }

    public String getMethod() {
        return method;
    }
}
