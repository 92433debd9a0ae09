/*
 [File Info]
 path: src/main/java/tech/robd/lurk/diagnostics/DiagnosticsBackend.java
 description: SLF4J sink behind Diagnostics (LocationAwareLogger when available).
              Global switch via system property `lurk.diag` and enable()/disable().
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SLF4J sink for {@link Diagnostics}.
 *
 * <p>Off by default. Switch on with {@code -Dlurk.diag=true} or {@link #enable()}.
 * Loggers are cached per owner class, and {@link LocationAwareLogger} is used when the binding
 * offers it so the logged location is the lurk class, not this one.
 *
 * <p>Errors are the exception to the switch: {@link #error} always writes, because the only
 * errors traced here are output failures that are about to be raised as fatal.
 */
public final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQCN = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * {@code -Dlurk.diag=true} turns debug tracing on at startup.
     */
    public static final String DIAGNOSTICS_PROPERTY_NAME = "lurk.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
        // no instances
    }

    // 🧩 Section: enablement

    public static void enable() {
        enabled = true;
    }

    public static void disable() {
        enabled = false;
    }

    public static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    private static Logger logger(Class<?> owner) {
        return LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
    }

    // 🧩 Section: emitters

    static void debug(Class<?> owner, String msg, Object... args) {
        if (!enabled) return;
        Logger log = logger(owner);
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, LocationAwareLogger.DEBUG_INT, msg, args, null);
        } else if (log.isDebugEnabled()) {
            log.debug(msg, args);
        }
    }

    static void error(Class<?> owner, String msg, Object... args) {
        Logger log = logger(owner);
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, LocationAwareLogger.ERROR_INT, msg, args, null);
        } else if (log.isErrorEnabled()) {
            log.error(msg, args);
        }
    }
    // [/🧩 Section: emitters]
}
