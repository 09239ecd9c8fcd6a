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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import trellis.core.exception.TrellisException;

/**
 * Thrown when a template file cannot be found. The "file" attribute is the template's path relative to the template
 * root, e.g. "Error/error500.html"; the "paths" attribute lists the directories that were searched.
 */
public class MissingTemplateException extends TrellisException {

    private static final long serialVersionUID = 1L;

    public MissingTemplateException(String file, List<String> paths) {
        this("Template file \"%s\" is missing.", file, paths);
    }

    protected MissingTemplateException(String messageTemplate, String file, List<String> paths) {
        super(messageTemplate, fileAndPaths(file, paths), DEFAULT_CODE, null);
    }

    private static Map<String, Object> fileAndPaths(String file, List<String> paths) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("file", file);
        attributes.put("paths", paths);
        return attributes;
    }

    public String getFile() {
        return (String) getAttribute("file");
    }
}
