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
package trellis.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

public class EventManagerTest {

    private static class RecordingListener implements EventListener {
        final List<String> seen = new ArrayList<>();

        @Override
        public Map<String, Consumer<Event>> implementedEvents() {
            Map<String, Consumer<Event>> events = new LinkedHashMap<>();
            events.put("Model.save", e -> seen.add("save"));
            events.put("Model.delete", e -> seen.add("delete"));
            return events;
        }
    }

    @Test
    public void testListenersCalledInOrder() {
        List<String> calls = new ArrayList<>();
        EventManager eventManager = new EventManager();
        eventManager.on("Model.save", e -> calls.add("first"));
        eventManager.on("Model.save", e -> calls.add("second"));
        Object subject = new Object();
        Event event = eventManager.dispatch("Model.save", subject);
        assertEquals(Arrays.asList("first", "second"), calls);
        assertSame(subject, event.getSubject());
    }

    @Test
    public void testStopPropagation() {
        List<String> calls = new ArrayList<>();
        EventManager eventManager = new EventManager();
        eventManager.on("Model.save", e -> {
            calls.add("first");
            e.stopPropagation();
            e.setResult("vetoed");
        });
        eventManager.on("Model.save", e -> calls.add("second"));
        Event event = eventManager.dispatch(new Event("Model.save"));
        assertEquals(Arrays.asList("first"), calls);
        assertTrue(event.isStopped());
        assertEquals("vetoed", event.getResult());
    }

    @Test
    public void testEventDataCanBeReplaced() {
        EventManager eventManager = new EventManager();
        eventManager.on("Dispatcher.afterDispatch", e -> e.setData("response", "replaced"));
        Event event = eventManager.dispatch(new Event("Dispatcher.afterDispatch", null,
                Collections.singletonMap("response", "original")));
        assertEquals("replaced", event.getData("response"));
    }

    @Test
    public void testListenerObjectsAttachOnce() {
        EventManager eventManager = new EventManager();
        RecordingListener listener = new RecordingListener();
        eventManager.on(listener).on(listener);
        eventManager.dispatch("Model.save", null);
        eventManager.dispatch("Model.delete", null);
        assertEquals(Arrays.asList("save", "delete"), listener.seen);

        eventManager.off(listener);
        eventManager.dispatch("Model.save", null);
        assertEquals(2, listener.seen.size());
        assertTrue(eventManager.listeners("Model.save").isEmpty());
    }

    @Test
    public void testListenerExceptionsPropagate() {
        EventManager eventManager = new EventManager();
        eventManager.on("Model.save", e -> {
            throw new IllegalStateException("read-only");
        });
        assertThrows(IllegalStateException.class, () -> eventManager.dispatch("Model.save", null));
    }
}
