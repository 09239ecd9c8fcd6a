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

import io.netty.handler.codec.http.HttpResponseStatus;
import trellis.core.exception.TrellisException;
import trellis.util.StringUtils;

/**
 * Superclass of exceptions that correspond to an HTTP error status. The message of an HttpException is always shown
 * to the user, even when debug mode is off, so it must not contain internal details.
 */
public class HttpException extends TrellisException {

    private static final long serialVersionUID = 1L;

    public HttpException(String msg) {
        super(msg, HttpResponseStatus.INTERNAL_SERVER_ERROR.code());
    }

    public HttpException(String msg, int code) {
        super(msg, code);
    }

    public HttpException(String msg, int code, Throwable cause) {
        super(msg, code, cause);
    }

    public HttpException(HttpResponseStatus status) {
        this(status.reasonPhrase(), status.code());
    }

    /** Create an exception for the given status. A null message is replaced by the status reason phrase. */
    public HttpException(HttpResponseStatus status, String msg, Throwable cause) {
        this(msg == null ? status.reasonPhrase() : msg, status.code(), cause);
    }

    /**
     * Return the exception name without the "Exception" suffix, and with spaces inserted at lowercase-uppercase
     * transitions, i.e. "MethodNotAllowedException" -> "Method Not Allowed".
     */
    public String getResponseType() {
        return StringUtils.humanizeExceptionName(getClass().getSimpleName());
    }
}
