/*
 [File Info]
 path: src/main/java/tech/robd/lurk/Lurk.java
 description: Static facade over the process-wide ResultReporter.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
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

/**
 * Entry point for the process-wide {@link ResultReporter}.
 *
 * <pre>{@code
 * Lurk.setConfiguration(ReportingConfig.builder().projectName("queue").build());
 *
 * int dequeue(Queue q) {
 *     if (q.isEmpty()) return Lurk.report(Results.FAILURE, "queue empty");
 *     ...
 * }
 * }</pre>
 *
 * <p>All methods delegate to {@link #reporter()}; see {@link ResultReporter} for the contracts.
 * The configuration installed here is shared by the whole JVM, including {@link Returns}.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Lurk {

    private static final ResultReporter GLOBAL = new ResultReporter();

    private Lurk() {
    }

    /**
     * @return the process-wide reporter
     */
    public static ResultReporter reporter() {
        return GLOBAL;
    }

    // 🧩 Section: configuration

    public static int setConfiguration(@Nullable ReportingConfig config) {
        return GLOBAL.setConfiguration(config);
    }

    public static int getDefaults(ReportingConfig.@Nullable Builder destination) {
        return GLOBAL.getDefaults(destination);
    }
    // [/🧩 Section: configuration]

    // 🧩 Section: dispatch

    public static int report(int result, @Nullable String format, @Nullable Object... args) {
        return GLOBAL.report(result, format, args);
    }

    public static int reportError(int result, @Nullable String caller, @Nullable String location,
                                  @Nullable String format, @Nullable Object... args) {
        return GLOBAL.reportError(result, caller, location, format, args);
    }
    // [/🧩 Section: dispatch]
}
