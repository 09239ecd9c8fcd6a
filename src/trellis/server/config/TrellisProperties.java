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
package trellis.server.config;

import java.util.Properties;
import java.util.logging.Level;

/**
 * Process-wide settings, read once from trellis.properties on the classpath. The fields are public so that an
 * application (or a test) can override them at startup.
 */
public class TrellisProperties {

    private static String propFilename = "trellis.properties";
    public static Properties properties = PropertyUtils.load(propFilename);

    // -----------------------------------------------------------------------------------------------------

    public static Level LOG_LEVEL = Level.INFO;
    static {
        String logLevelStr = properties.getProperty("loglevel", "INFO");
        try {
            LOG_LEVEL = Level.parse(logLevelStr.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Could not parse loglevel in properties file: " + logLevelStr, e);
        }
    }

    /** In debug mode, error pages show the real exception message, stack trace and custom handlers. */
    public static boolean DEBUG = PropertyUtils.getPropertyBoolean(properties, "debug", false);

    /** Base package of the application; controllers, views and helpers are looked up beneath it. */
    public static String APP_PACKAGE = PropertyUtils.getPropertyString(properties, "app.package", "app");

    /** Classpath directory that holds the HTML templates. */
    public static String TEMPLATES_ROOT = PropertyUtils.getPropertyString(properties, "templates.root", "templates");

    /** Renderer class used by the error handler, needs a (Throwable, Request, Router) constructor. */
    public static String ERROR_RENDERER = PropertyUtils.getPropertyString(properties, "error.renderer",
            "trellis.error.ExceptionRenderer");

    /** Host header of requests built when no request is available. */
    public static String SERVER_HOST = PropertyUtils.getPropertyString(properties, "server.host", "localhost");

    public static boolean PRETTY_PRINT_HTML = PropertyUtils.getPropertyBoolean(properties, "prettyprint.html", true);
    public static boolean PRETTY_PRINT_JSON = PropertyUtils.getPropertyBoolean(properties, "prettyprint.json", false);

}
