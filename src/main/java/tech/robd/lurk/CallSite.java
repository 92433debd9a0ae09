/*
 [File Info]
 path: src/main/java/tech/robd/lurk/CallSite.java
 description: Caller method name and line number captured from the current stack, for error reports.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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
package tech.robd.lurk;

import org.jspecify.annotations.Nullable;

import java.util.HashSet;
import java.util.Set;

/**
 * The {@code (caller, location)} pair passed to
 * {@link ResultReporter#reportError(int, String, String, String, Object...)}: the calling method's
 * name and its line number as text. Either may be {@code null} when the stack does not tell.
 *
 * @param caller   method name, e.g. {@code "dequeue"}
 * @param location line number, e.g. {@code "42"}
 */
public record CallSite(@Nullable String caller, @Nullable String location) {

    private static final CallSite UNKNOWN = new CallSite(null, null);

    /**
     * The first frame outside this class, {@link Thread} and any of {@code skip}.
     *
     * @param skip helper classes whose frames sit between the caller and here
     */
    public static CallSite capture(Class<?>... skip) {
        Set<String> skipped = new HashSet<>();
        skipped.add(Thread.class.getName());
        skipped.add(CallSite.class.getName());
        for (Class<?> c : skip) skipped.add(c.getName());

        for (StackTraceElement frame : Thread.currentThread().getStackTrace()) {
            if (skipped.contains(frame.getClassName())) continue;
            int line = frame.getLineNumber();
            return new CallSite(frame.getMethodName(), line >= 0 ? Integer.toString(line) : null);
        }
        return UNKNOWN;
    }
}
