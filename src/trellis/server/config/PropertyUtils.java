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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import trellis.util.Log;

/**
 * Property file loading and typed property access. A missing properties file is reported on stderr, since the
 * logger itself is configured from these properties.
 */
public class PropertyUtils {

    /** Load a properties file from the classpath. A missing file gives an empty set of properties. */
    public static Properties load(String propFilename) {
        Properties properties = new Properties();
        try (InputStream inputStream = PropertyUtils.class.getClassLoader().getResourceAsStream(propFilename)) {
            if (inputStream == null) {
                System.err.println(propFilename + " not found on the classpath, using defaults");
            } else {
                properties.load(inputStream);
            }
            return properties;

        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + propFilename, e);
        }
    }

    public static final boolean getPropertyBoolean(Properties properties, String propName, boolean defaultValue) {
        String opt = properties.getProperty(propName);
        if (opt == null) {
            return defaultValue;
        } else {
            opt = opt.toLowerCase().trim();
            if (opt.equals("1") || opt.equals("true") || opt.equals("t") || opt.equals("yes") || opt.equals("y")) {
                return true;
            } else if (opt.equals("0") || opt.equals("false") || opt.equals("f") || opt.equals("no")
                    || opt.equals("n")) {
                return false;
            } else {
                Log.warning("Unrecognized property value: " + propName + "=" + properties.getProperty(propName));
                return defaultValue;
            }
        }
    }

    public static final String getPropertyString(Properties properties, String propName, String defaultValue) {
        String opt = properties.getProperty(propName);
        return opt == null || opt.trim().isEmpty() ? defaultValue : opt.trim();
    }

}
