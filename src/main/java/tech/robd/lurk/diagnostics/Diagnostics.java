/*
 [File Info]
 path: src/main/java/tech/robd/lurk/diagnostics/Diagnostics.java
 description: Internal tracing facade bound to an owner class. Forwards to DiagnosticsBackend (SLF4J)
              and resolves to a no-op when tracing is switched off.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

package tech.robd.lurk.diagnostics;

/**
 * Tracing for lurk's own internals, separate from the result lines it reports.
 * <p>
 * Instance methods forward to {@link DiagnosticsBackend}, which writes through SLF4J. Tracing is
 * off unless {@code -Dlurk.diag=true} is set or {@link DiagnosticsBackend#enable()} is called.
 * Instances from {@link #of(Class)} check the backend flag on every call, so they follow later
 * {@code enable()}/{@code disable()} calls.
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the class whose SLF4J logger receives this instance's messages
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * @param msg  SLF4J-style message pattern
     * @param args arguments for {@code msg}; a trailing {@link Throwable} is logged as such
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    /**
     * @param msg  SLF4J-style message pattern
     * @param args arguments for {@code msg}; a trailing {@link Throwable} is logged as such
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    static Diagnostics of(Class<?> owner) {
        return new OwnedDiagnostics(owner);
    }
    // [/🧩 Section: factories]
}
