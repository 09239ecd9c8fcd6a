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
package trellis.http.exception;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * This exception is thrown when a resource does not support the HTTP method of the request (405).
 */
public class MethodNotAllowedException extends HttpException {

    private static final long serialVersionUID = 1L;

    public MethodNotAllowedException() {
        super(HttpResponseStatus.METHOD_NOT_ALLOWED);
    }

    public MethodNotAllowedException(String msg) {
        super(HttpResponseStatus.METHOD_NOT_ALLOWED, msg, null);
    }

    public MethodNotAllowedException(String msg, Throwable cause) {
        super(HttpResponseStatus.METHOD_NOT_ALLOWED, msg, cause);
    }

    /** Create an exception that lists the allowed methods in an "Allow" header of the error response. */
    public static MethodNotAllowedException allowing(String... allowedMethods) {
        MethodNotAllowedException e = new MethodNotAllowedException();
        e.setResponseHeader(HttpHeaderNames.ALLOW.toString(), String.join(", ", allowedMethods));
        return e;
    }
}
