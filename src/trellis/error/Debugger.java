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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Debugger {

    /**
     * Format the stack trace of a throwable as a list of frames. Each frame is a map with the keys "file", "line"
     * and "reference" (the class and method name).
     * 
     * @param maxDepth
     *            The maximum number of frames to include, or a negative number for all frames.
     */
    public static List<Map<String, Object>> formatTrace(Throwable throwable, int maxDepth) {
        StackTraceElement[] stackTrace = throwable.getStackTrace();
        int n = maxDepth < 0 ? stackTrace.length : Math.min(maxDepth, stackTrace.length);
        List<Map<String, Object>> frames = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            StackTraceElement element = stackTrace[i];
            Map<String, Object> frame = new LinkedHashMap<>();
            frame.put("file", element.getFileName() == null ? "[unknown]" : element.getFileName());
            frame.put("line", element.getLineNumber());
            frame.put("reference", element.getClassName() + "." + element.getMethodName());
            frames.add(frame);
        }
        return frames;
    }

    public static List<Map<String, Object>> formatTrace(Throwable throwable) {
        return formatTrace(throwable, -1);
    }

    /** The source file the throwable was thrown from, or null if unknown. */
    public static String file(Throwable throwable) {
        StackTraceElement[] stackTrace = throwable.getStackTrace();
        return stackTrace.length == 0 ? null : stackTrace[0].getFileName();
    }

    /** The line number the throwable was thrown from, or null if unknown. */
    public static Integer line(Throwable throwable) {
        StackTraceElement[] stackTrace = throwable.getStackTrace();
        return stackTrace.length == 0 || stackTrace[0].getLineNumber() < 0 ? null
                : Integer.valueOf(stackTrace[0].getLineNumber());
    }
}
