/*
 [File Info]
 path: src/main/java/tech/robd/lurk/ErrorHandler.java
 description: Pluggable handler for the error channel of result reporting.
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

/**
 * Receives results reported via
 * {@link ResultReporter#reportError(int, String, String, String, Object...)}.
 * <p>
 * {@code caller} and {@code location} are passed through exactly as given, so either may be
 * {@code null}; substituting placeholders is up to the handler.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param result   the result being reported
     * @param caller   the calling method, may be {@code null}
     * @param location where in the caller, usually a line number, may be {@code null}
     * @param message  the formatted message, never {@code null}
     */
    void error(int result, @Nullable String caller, @Nullable String location, String message);
}
