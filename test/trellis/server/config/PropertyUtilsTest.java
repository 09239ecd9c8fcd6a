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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.Test;

import trellis.util.Log;

public class PropertyUtilsTest {

    private static class RecordingHandler extends Handler {
        final List<LogRecord> records = new ArrayList<>();

        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }

    @Test
    public void testLoadFromClasspath() {
        Properties properties = PropertyUtils.load("trellis.properties");
        assertEquals("trellis.testapp", properties.getProperty("app.package"));
        assertTrue(PropertyUtils.load("no-such.properties").isEmpty());
    }

    @Test
    public void testBooleanValues() {
        Properties properties = new Properties();
        properties.setProperty("a", " Yes ");
        properties.setProperty("b", "0");
        assertTrue(PropertyUtils.getPropertyBoolean(properties, "a", false));
        assertFalse(PropertyUtils.getPropertyBoolean(properties, "b", true));
        assertTrue(PropertyUtils.getPropertyBoolean(properties, "missing", true));
    }

    @Test
    public void testUnrecognizedBooleanIsLoggedAndDefaulted() {
        // Make sure the log handlers are set up before adding the recording handler
        Log.fine("Checking unrecognized property values");
        Logger logger = Logger.getGlobal();
        RecordingHandler handler = new RecordingHandler();
        logger.addHandler(handler);
        try {
            Properties properties = new Properties();
            properties.setProperty("debug", "sometimes");
            assertTrue(PropertyUtils.getPropertyBoolean(properties, "debug", true));
            assertEquals(1, handler.records.size());
            assertEquals(Level.WARNING, handler.records.get(0).getLevel());
            assertTrue(handler.records.get(0).getMessage().contains("debug=sometimes"));
        } finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    public void testStringValues() {
        Properties properties = new Properties();
        properties.setProperty("host", " example.com ");
        properties.setProperty("blank", "  ");
        assertEquals("example.com", PropertyUtils.getPropertyString(properties, "host", "localhost"));
        assertEquals("localhost", PropertyUtils.getPropertyString(properties, "blank", "localhost"));
    }
}
