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
package trellis.core.exception;

/** Thrown when a plugin is referenced that has not been loaded. */
public class MissingPluginException extends TrellisException {

    private static final long serialVersionUID = 1L;

    public MissingPluginException(String plugin) {
        super("Plugin %s could not be found.", attributes("plugin", plugin), DEFAULT_CODE, null);
    }

    public String getPlugin() {
        return (String) getAttribute("plugin");
    }
}
