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

import trellis.core.exception.TrellisException;

/**
 * Wraps a java.lang.Error (e.g. a StackOverflowError) so that it can be handled and rendered like an exception. The
 * exception renderer unwraps it, so error pages describe the underlying Error.
 */
public class FatalErrorException extends TrellisException {

    private static final long serialVersionUID = 1L;

    private final Error error;

    public FatalErrorException(Error error) {
        super(error.getMessage() == null ? error.getClass().getName() : error.getMessage(), DEFAULT_CODE, error);
        this.error = error;
    }

    public Error getError() {
        return error;
    }
}
