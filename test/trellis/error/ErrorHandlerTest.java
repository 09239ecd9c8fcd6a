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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import trellis.http.exception.ForbiddenException;
import trellis.http.exception.NotFoundException;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.routing.Router;
import trellis.server.config.TrellisProperties;

public class ErrorHandlerTest {

    private static final String DEFAULT_ERROR_RENDERER = TrellisProperties.ERROR_RENDERER;
    private static final String DEFAULT_APP_PACKAGE = TrellisProperties.APP_PACKAGE;

    @AfterEach
    public void resetConfig() {
        TrellisProperties.ERROR_RENDERER = DEFAULT_ERROR_RENDERER;
        TrellisProperties.APP_PACKAGE = DEFAULT_APP_PACKAGE;
    }

    public static class ExplodingRenderer extends ExceptionRenderer {
        public ExplodingRenderer(Throwable error, Request request, Router router) {
            super(error, request, router);
        }

        @Override
        public Response render() {
            throw new IllegalStateException("Renderer exploded");
        }
    }

    public static class TeapotRenderer extends ExceptionRenderer {
        public TeapotRenderer(Throwable error, Request request, Router router) {
            super(error, request, router);
        }

        @Override
        public Response render() {
            return new Response(HttpResponseStatus.valueOf(418)).setBody(getError().getMessage());
        }
    }

    private static Request request(String uri) {
        return new Request(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri));
    }

    @Test
    public void testHandleException() {
        Response response = new ErrorHandler().handleException(new ForbiddenException("Members only"),
                request("/admin"));
        assertEquals(403, response.getStatusCode());
        assertTrue(response.getBody().contains("Members only"));

        FullHttpResponse httpRes = response.toHttpResponse();
        assertEquals(HttpResponseStatus.FORBIDDEN, httpRes.status());
        assertEquals("text/html;charset=utf-8", httpRes.headers().get(HttpHeaderNames.CONTENT_TYPE));
        httpRes.release();
    }

    @Test
    public void testHandleError() {
        Response response = new ErrorHandler().handleError(new StackOverflowError(), request("/recurse"));
        assertEquals(500, response.getStatusCode());
        assertTrue(response.getBody().contains(ExceptionRenderer.GENERIC_ERROR_MESSAGE));
    }

    @Test
    public void testConfiguredRendererIsUsed() {
        TrellisProperties.ERROR_RENDERER = TeapotRenderer.class.getName();
        Response response = new ErrorHandler(new Router()).handleException(new RuntimeException("short and stout"),
                null);
        assertEquals(418, response.getStatusCode());
        assertEquals("short and stout", response.getBody());
    }

    @Test
    public void testUnknownRendererFallsBackToDefault() {
        TrellisProperties.ERROR_RENDERER = "trellis.error.NoSuchRenderer";
        Response response = new ErrorHandler().handleException(new ForbiddenException("Members only"),
                request("/admin"));
        assertEquals(403, response.getStatusCode());
    }

    @Test
    public void testFailingRendererGivesPlainTextError() {
        TrellisProperties.ERROR_RENDERER = ExplodingRenderer.class.getName();
        Response response = new ErrorHandler().handleException(new RuntimeException("x"), request("/"));
        assertEquals(500, response.getStatusCode());
        assertEquals("text/plain;charset=utf-8", response.getContentType());
        assertEquals(ErrorHandler.FALLBACK_MESSAGE, response.getBody());
    }

    @Test
    public void testErrorControllerFailingClassInitializationStillResponds() {
        TrellisProperties.APP_PACKAGE = "trellis.testapp.staticfail";
        Response response = new ErrorHandler().handleException(new NotFoundException("No such post"),
                request("/posts/1"));
        assertEquals(404, response.getStatusCode());
        assertTrue(response.getBody().contains("No such post"), response.getBody());
    }
}
