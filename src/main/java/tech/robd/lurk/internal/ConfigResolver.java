/*
 [File Info]
 path: src/main/java/tech/robd/lurk/internal/ConfigResolver.java
 description: Field-by-field fallback from an optional override config to the defaults.
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
package tech.robd.lurk.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.lurk.ReportingConfig;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the configuration a reporter actually uses.
 *
 * <p>For each field: no override installed, or the override leaves the field {@code null}, means
 * the default's value for that field; otherwise the override's value. The defaults must set every
 * field except the streams, which fall back to {@link System#out}/{@link System#err} as read at
 * resolve time so that {@link System#setOut(PrintStream)} is honoured.
 */
public final class ConfigResolver {

    private ConfigResolver() {
    }

    /**
     * @param override the installed override, or {@code null}
     * @param defaults the compiled-in defaults
     * @return the resolved snapshot
     * @throws NullPointerException if {@code defaults} leaves a non-stream field unset
     */
    public static ResolvedConfig resolve(@Nullable ReportingConfig override, ReportingConfig defaults) {
        return new ResolvedConfig(
                pick(override, defaults, ReportingConfig::projectName, "projectName"),
                pick(override, defaults, ReportingConfig::prefix, "prefix"),
                pick(override, defaults, ReportingConfig::postfix, "postfix"),
                pick(override, defaults, ReportingConfig::logEnabled, "logEnabled"),
                pick(override, defaults, ReportingConfig::errEnabled, "errEnabled"),
                pick(override, defaults, ReportingConfig::logHandler, "logHandler"),
                pick(override, defaults, ReportingConfig::errorHandler, "errorHandler"),
                stream(override, defaults, ReportingConfig::out, System.out),
                stream(override, defaults, ReportingConfig::err, System.err));
    }

    private static <T> T pick(@Nullable ReportingConfig override,
                              ReportingConfig defaults,
                              Function<ReportingConfig, @Nullable T> field,
                              String name) {
        if (override != null) {
            T value = field.apply(override);
            if (value != null) return value;
        }
        return Objects.requireNonNull(field.apply(defaults), () -> "default " + name + " is unset");
    }

    private static PrintStream stream(@Nullable ReportingConfig override,
                                      ReportingConfig defaults,
                                      Function<ReportingConfig, @Nullable PrintStream> field,
                                      PrintStream system) {
        if (override != null) {
            PrintStream value = field.apply(override);
            if (value != null) return value;
        }
        return Objects.requireNonNullElse(field.apply(defaults), system);
    }
}
