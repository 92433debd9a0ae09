/*
 [File Info]
 path: src/main/java/tech/robd/lurk/internal/DefaultReporters.java
 description: Built-in log and error handlers: timestamped result lines on the configured out/err streams.
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
import tech.robd.lurk.ErrorHandler;
import tech.robd.lurk.LogHandler;
import tech.robd.lurk.ReportWriteError;
import tech.robd.lurk.diagnostics.Diagnostics;

import java.io.PrintStream;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The handlers used when no custom handler is configured.
 *
 * <p>Line formats, with no separators beyond the ones shown:
 * <pre>
 * log: HH:MM:SS  %08x  [project]  prefix message postfix          (to out)
 * err: HH:MM:SS  %08x  [project:caller.location]  prefix message postfix   (to err)
 * </pre>
 * Time is the UTC time of the clock given at construction, whatever the clock's zone. Digits are
 * always ASCII, whatever the default locale.
 * A {@code null} caller prints as {@value #UNKNOWN_CALLER} and a {@code null} location as
 * {@value #UNKNOWN_LOCATION}.
 *
 * <p>Configuration is re-read on every call, so a disabled channel writes nothing even when
 * this handler is invoked directly. A write that leaves the stream in an error state is logged
 * and raised as {@link ReportWriteError}.
 */
public final class DefaultReporters implements LogHandler, ErrorHandler {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(DefaultReporters.class);
    // [/🧩 Section: diagnostics]

    public static final String UNKNOWN_CALLER = "(unknown)";
    public static final String UNKNOWN_LOCATION = "???";

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final Supplier<ResolvedConfig> config;
    private final Clock clock;

    /**
     * @param config supplies the active configuration at call time
     * @param clock  source of the HH:MM:SS timestamp
     */
    public DefaultReporters(Supplier<ResolvedConfig> config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // 🧩 Section: handlers

    @Override
    public void log(int result, String message) {
        ResolvedConfig cfg = config.get();
        if (!cfg.logEnabled()) return;

        String header = String.format(Locale.ROOT, "%s  %08x  [%s]  ", timestamp(), result, cfg.projectName());
        write(cfg.out(), "log", result, header + cfg.prefix() + message + cfg.postfix());
    }

    @Override
    public void error(int result, @Nullable String caller, @Nullable String location, String message) {
        ResolvedConfig cfg = config.get();
        if (!cfg.errEnabled()) return;

        if (caller == null) caller = UNKNOWN_CALLER;
        if (location == null) location = UNKNOWN_LOCATION;

        String header = String.format(Locale.ROOT, "%s  %08x  [%s:%s.%s]  ",
                timestamp(), result, cfg.projectName(), caller, location);
        write(cfg.err(), "err", result, header + cfg.prefix() + message + cfg.postfix());
    }
    // [/🧩 Section: handlers]

    // 🧩 Section: output

    private String timestamp() {
        return TIME.format(clock.instant());
    }

    private static void write(PrintStream stream, String channel, int result, String line) {
        stream.print(line);
        // checkError() also flushes
        if (stream.checkError()) {
            ReportWriteError failure = new ReportWriteError(channel, result);
            DIAG.error("Result reporting failed on the {} channel", channel, failure);
            throw failure;
        }
    }
    // [/🧩 Section: output]
}
