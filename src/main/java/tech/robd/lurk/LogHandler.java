/*
 [File Info]
 path: src/main/java/tech/robd/lurk/LogHandler.java
 description: Pluggable handler for the log channel of result reporting.
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

/**
 * Receives results reported via {@link ResultReporter#report(int, String, Object...)}.
 * <p>
 * The message is already formatted; the handler decides where it goes and whether a line
 * terminator is added. The reporter only calls a handler when the log channel is enabled and a
 * message was given. Handlers are held by reference and never closed by the reporter.
 */
@FunctionalInterface
public interface LogHandler {

    /**
     * @param result  the result being reported
     * @param message the formatted message, never {@code null}
     */
    void log(int result, String message);
}
