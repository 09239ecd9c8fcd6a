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

/**
 * Renders the error page for one type of exception, in place of the templated error page. Handlers are registered
 * with an {@link ExceptionHandlerRegistry}, and are only consulted in debug mode or for HTTP exceptions.
 * 
 * @param <T>
 *            The type of exception handled.
 */
@FunctionalInterface
public interface CustomErrorHandler<T extends Throwable> {

    /**
     * Handle the exception.
     * 
     * @param renderer
     *            The renderer, which gives access to the error controller and its response.
     * @return A Response, or a String to use as the body of the error controller's response.
     */
    Object handle(ExceptionRenderer renderer, T exception);
}
