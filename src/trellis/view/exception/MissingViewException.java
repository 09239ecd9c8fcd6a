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
package trellis.view.exception;

import trellis.core.exception.TrellisException;

/** Thrown when a view class name cannot be resolved to a usable view class. */
public class MissingViewException extends TrellisException {

    private static final long serialVersionUID = 1L;

    public MissingViewException(String className) {
        this(className, null);
    }

    public MissingViewException(String className, Throwable cause) {
        super("View class \"%s\" is missing.", attributes("class", className), DEFAULT_CODE, cause);
    }
}
