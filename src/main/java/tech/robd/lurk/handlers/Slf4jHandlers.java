/*
 [File Info]
 path: src/main/java/tech/robd/lurk/handlers/Slf4jHandlers.java
 description: LogHandler/ErrorHandler implementations that forward reported results to an SLF4J Logger.
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
package tech.robd.lurk.handlers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.robd.lurk.ErrorHandler;
import tech.robd.lurk.LogHandler;
import tech.robd.lurk.ReportingConfig;
import tech.robd.lurk.Results;
import tech.robd.lurk.internal.DefaultReporters;

import java.util.Objects;

/**
 * Custom handlers that hand results to SLF4J instead of writing lines to {@code out}/{@code err}.
 *
 * <pre>{@code
 * Lurk.setConfiguration(Slf4jHandlers.configFor(LoggerFactory.getLogger("queue")));
 * }</pre>
 *
 * <p>Prefix, postfix and project name are not applied: layout is the logging backend's business.
 * The enable flags still apply, since the reporter checks them before calling any handler.
 *
 * <ul>
 *   <li>log channel: {@code "[{result}] {message}"} at WARN for errors ({@code result < 0}), INFO otherwise;</li>
 *   <li>error channel: {@code "[{result}] {caller}.{location}: {message}"} at ERROR.</li>
 * </ul>
 * {@code result} is rendered with {@link Results#describe(int)}.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Slf4jHandlers {

    private Slf4jHandlers() {
    }

    // 🧩 Section: factories

    public static LogHandler logHandler(Logger logger) {
        Objects.requireNonNull(logger, "logger");
        return (result, message) -> {
            if (Results.isError(result)) {
                logger.warn("[{}] {}", Results.describe(result), message);
            } else {
                logger.info("[{}] {}", Results.describe(result), message);
            }
        };
    }

    public static ErrorHandler errorHandler(Logger logger) {
        Objects.requireNonNull(logger, "logger");
        return (result, caller, location, message) -> logger.error("[{}] {}.{}: {}",
                Results.describe(result),
                caller != null ? caller : DefaultReporters.UNKNOWN_CALLER,
                location != null ? location : DefaultReporters.UNKNOWN_LOCATION,
                message);
    }

    /**
     * @return a config routing both channels to {@code logger}, every other field unset
     */
    public static ReportingConfig configFor(Logger logger) {
        return ReportingConfig.builder()
                .logHandler(logHandler(logger))
                .errorHandler(errorHandler(logger))
                .build();
    }

    /**
     * @return {@link #configFor(Logger)} with the logger named {@code name}
     */
    public static ReportingConfig configFor(String name) {
        return configFor(LoggerFactory.getLogger(name));
    }
    // [/🧩 Section: factories]
}
