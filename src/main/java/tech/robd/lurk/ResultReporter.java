/*
 [File Info]
 path: src/main/java/tech/robd/lurk/ResultReporter.java
 description: Dispatch entry points (report / reportError) over a swappable reporting configuration
              with per-field fallback to the compiled-in defaults.
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
import tech.robd.lurk.diagnostics.Diagnostics;
import tech.robd.lurk.internal.ConfigResolver;
import tech.robd.lurk.internal.DefaultReporters;
import tech.robd.lurk.internal.ResolvedConfig;

import java.time.Clock;
import java.util.Locale;

/**
 * Reports results through a log channel and an error channel.
 *
 * <p>Both entry points return the result they were given, whatever happens inside, so they can
 * be the expression of a {@code return}:
 * <pre>{@code
 * if (count < 0) return reporter.reportError(Results.BAD_PARAM, "resize", "12", "Bad count %d", count);
 * }</pre>
 *
 * <p>A {@code null} or empty format is a deliberate no-op. A disabled channel writes nothing.
 * Otherwise the channel's handler from the active configuration is called: the custom one when
 * set, else the built-in {@link DefaultReporters}. Exceptions thrown by a custom handler are not
 * caught here.
 *
 * <p><strong>Configuration:</strong> one override at a time, installed with
 * {@link #setConfiguration(ReportingConfig)}; unset fields fall back to {@link #defaults()} one by
 * one. The override is a single {@code volatile} reference: a new one is visible to other threads,
 * but a caller swapping configurations while others report gets last-writer-wins and nothing
 * more. Callers needing more must synchronise externally.
 *
 * <p>Most code uses the process-wide instance through {@link Lurk}. Separate instances are
 * useful when a component wants its own configuration, and in tests.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class ResultReporter {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ResultReporter.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final DefaultReporters builtIn;
    private final ReportingConfig defaults;

    private volatile @Nullable ReportingConfig override;
    // [/🧩 Section: state]

    /**
     * Reporter timestamping in UTC.
     */
    public ResultReporter() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the timestamps written by the built-in reporters
     */
    public ResultReporter(Clock clock) {
        this.builtIn = new DefaultReporters(this::resolved, clock);
        this.defaults = ReportingConfig.builder()
                .projectName(ReportingConfig.DEFAULT_PROJECT_NAME)
                .prefix(ReportingConfig.DEFAULT_PREFIX)
                .postfix(ReportingConfig.DEFAULT_POSTFIX)
                .logEnabled(true)
                .errEnabled(true)
                .logHandler(builtIn)
                .errorHandler(builtIn)
                .build();
    }

    // 🧩 Section: configuration

    /**
     * Install {@code config} as the active override, replacing any previous one.
     * {@code null} goes back to the defaults.
     * <p>
     * A built-in handler taken from another reporter (for example through its
     * {@link #getDefaults(ReportingConfig.Builder)}) is replaced by this reporter's own, so the
     * lines it writes follow this reporter's configuration.
     *
     * @return {@link Results#SUCCESS}, always
     */
    public int setConfiguration(@Nullable ReportingConfig config) {
        this.override = adopt(config);
        if (config == null) {
            DIAG.debug("Reporting configuration reset to defaults");
        } else {
            DIAG.debug("Reporting configuration installed: {}", config);
        }
        return Results.SUCCESS;
    }

    private @Nullable ReportingConfig adopt(@Nullable ReportingConfig config) {
        if (config == null) return null;
        boolean foreignLog = config.logHandler() instanceof DefaultReporters && config.logHandler() != builtIn;
        boolean foreignErr = config.errorHandler() instanceof DefaultReporters && config.errorHandler() != builtIn;
        if (!foreignLog && !foreignErr) return config;

        ReportingConfig.Builder rebound = config.toBuilder();
        if (foreignLog) rebound.logHandler(builtIn);
        if (foreignErr) rebound.errorHandler(builtIn);
        return rebound.build();
    }

    /**
     * @return the installed override, or {@code null} when the defaults are in use
     */
    public @Nullable ReportingConfig configuration() {
        return override;
    }

    /**
     * The compiled-in defaults. The {@code out} and {@code err} fields are unset: the built-in
     * reporters use whatever {@link System#out}/{@link System#err} are when they write.
     */
    public ReportingConfig defaults() {
        return defaults;
    }

    /**
     * Fill {@code destination} with the defaults, typically to then change a few fields:
     * <pre>{@code
     * ReportingConfig.Builder b = ReportingConfig.builder();
     * reporter.getDefaults(b);
     * reporter.setConfiguration(b.prefix("> ").build());
     * }</pre>
     * The copied handlers are this reporter's built-in ones. Installing them on a different
     * reporter is fine: {@link #setConfiguration(ReportingConfig)} swaps them for that
     * reporter's own.
     *
     * @return {@link Results#SUCCESS}, or {@link Results#BAD_PARAM} (and nothing written) if
     * {@code destination} is {@code null}
     */
    public int getDefaults(ReportingConfig.@Nullable Builder destination) {
        if (destination == null) return Results.BAD_PARAM;
        destination.copyFrom(defaults);
        return Results.SUCCESS;
    }

    /**
     * @return the configuration in effect right now, with all fallbacks applied
     */
    public ResolvedConfig resolved() {
        return ConfigResolver.resolve(override, defaults);
    }
    // [/🧩 Section: configuration]

    // 🧩 Section: dispatch

    /**
     * Report {@code result} on the log channel.
     *
     * @param result the result to report and return
     * @param format message, or a {@link String#format} pattern when {@code args} are given;
     *               {@code null} or empty reports nothing
     * @param args   format arguments
     * @return {@code result}, unchanged
     */
    public int report(int result, @Nullable String format, @Nullable Object... args) {
        if (format == null || format.isEmpty()) return result;

        ResolvedConfig cfg = resolved();
        if (!cfg.logEnabled()) return result;

        cfg.logHandler().log(result, message(format, args));
        return result;
    }

    /**
     * Report {@code result} on the error channel.
     *
     * @param result   the result to report and return
     * @param caller   the calling method, may be {@code null}
     * @param location where in the caller, may be {@code null}
     * @param format   message, or a {@link String#format} pattern when {@code args} are given;
     *                 {@code null} or empty reports nothing
     * @param args     format arguments
     * @return {@code result}, unchanged
     */
    public int reportError(int result, @Nullable String caller, @Nullable String location,
                           @Nullable String format, @Nullable Object... args) {
        if (format == null || format.isEmpty()) return result;

        ResolvedConfig cfg = resolved();
        if (!cfg.errEnabled()) return result;

        cfg.errorHandler().error(result, caller, location, message(format, args));
        return result;
    }
    // [/🧩 Section: dispatch]

    // Plain messages are passed through untouched so a literal '%' needs no escaping.
    private static String message(String format, @Nullable Object @Nullable [] args) {
        if (args == null || args.length == 0) return format;
        return String.format(Locale.ROOT, format, args);
    }
}
