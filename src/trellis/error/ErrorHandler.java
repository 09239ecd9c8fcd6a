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

import io.netty.handler.codec.http.HttpResponseStatus;

import trellis.http.exception.HttpException;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.routing.Router;
import trellis.server.config.TrellisProperties;
import trellis.util.Log;
import trellis.util.Reflection;

/**
 * Entry point for uncaught exceptions: logs the exception, then renders the error response with the configured
 * exception renderer class (property "error.renderer"). Never throws an Exception:
 * if rendering fails, a plain-text 500 response is returned.
 */
public class ErrorHandler {

    public static final String FALLBACK_MESSAGE = "An Internal Server Error Occurred";

    private final Router router;

    public ErrorHandler() {
        this(null);
    }

    public ErrorHandler(Router router) {
        this.router = router;
    }

    /** Log the exception and render the error response for it. */
    public Response handleException(Throwable exception, Request request) {
        logException(exception, request);
        try {
            return getRenderer(exception, request).render();
        } catch (Exception e) {
            // Fallback in case there's an exception in the exception renderer
            Log.exception("Exception in exception renderer while handling "
                    + (request == null ? "request" : request.getRequestTarget()), e);
            return new Response(HttpResponseStatus.INTERNAL_SERVER_ERROR).setContentType("text")
                    .setBody(FALLBACK_MESSAGE);
        }
    }

    /** Wrap the Error in a FatalErrorException, then handle it like an exception. */
    public Response handleError(Error error, Request request) {
        return handleException(new FatalErrorException(error), request);
    }

    /**
     * Create the exception renderer. The class named by the "error.renderer" property must have a public constructor
     * taking (Throwable, Request, Router).
     */
    protected ExceptionRenderer getRenderer(Throwable exception, Request request) throws InstantiationException {
        Class<?> rendererClass = Reflection.classForNameOrNull(TrellisProperties.ERROR_RENDERER);
        if (rendererClass == null || !ExceptionRenderer.class.isAssignableFrom(rendererClass)) {
            Log.warning("Exception renderer class " + TrellisProperties.ERROR_RENDERER
                    + " not found, using " + ExceptionRenderer.class.getName());
            rendererClass = ExceptionRenderer.class;
        }
        return Reflection.instantiateWithConstructor(rendererClass.asSubclass(ExceptionRenderer.class),
                new Class<?>[] { Throwable.class, Request.class, Router.class }, exception, request, router);
    }

    protected void logException(Throwable exception, Request request) {
        String target = request == null ? "" : " while handling " + request.getMethod() + " "
                + request.getRequestTarget();
        if (exception instanceof HttpException && ((HttpException) exception).getCode() < 500) {
            // Client errors are routine
            Log.fine(((HttpException) exception).getResponseType() + target + ": " + exception.getMessage());
        } else {
            Log.exceptionWithoutCallerRef(exception.getClass().getSimpleName() + target, exception);
        }
    }
}
