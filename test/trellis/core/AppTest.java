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
package trellis.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import trellis.controller.ErrorController;
import trellis.core.exception.MissingPluginException;
import trellis.testapp.blog.view.FeedView;
import trellis.testapp.view.CustomView;
import trellis.view.JsonView;

public class AppTest {

    @AfterEach
    public void unloadPlugins() {
        Plugins.unloadAll();
    }

    @Test
    public void testApplicationClassesComeFirst() {
        assertEquals(CustomView.class, App.className("Custom", "view", "View"));
    }

    @Test
    public void testFrameworkClassesAreFallback() {
        assertEquals(JsonView.class, App.className("Json", "view", "View"));
        assertEquals(ErrorController.class, App.className("Error", "controller", "Controller"));
    }

    @Test
    public void testUnknownNames() {
        assertNull(App.className("Nonexistent", "view", "View"));
        assertNull(App.className("", "view", "View"));
        assertNull(App.className(null, "view", "View"));
    }

    @Test
    public void testPluginQualifiedNames() {
        assertNull(App.className("Blog.Feed", "view", "View"));
        Plugins.load("Blog", "trellis.testapp.blog");
        assertTrue(Plugins.isLoaded("Blog"));
        assertEquals(FeedView.class, App.className("Blog.Feed", "view", "View"));
        // Plugin classes do not fall back to the framework
        assertNull(App.className("Blog.Json", "view", "View"));
    }

    @Test
    public void testSplitPluginName() {
        assertArrayEquals(new String[] { "Blog", "Feed" }, App.splitPluginName("Blog.Feed"));
        assertArrayEquals(new String[] { null, "Feed" }, App.splitPluginName("Feed"));
    }

    @Test
    public void testPlugins() {
        assertThrows(MissingPluginException.class, () -> Plugins.getBasePackage("Blog"));
        assertThrows(IllegalArgumentException.class, () -> Plugins.load("Blog.Admin", "x"));
        Plugins.load("Blog", "trellis.testapp.blog");
        assertEquals("trellis.testapp.blog", Plugins.getBasePackage("Blog"));
        Plugins.unload("Blog");
        assertTrue(Plugins.loaded().isEmpty());
    }
}
