/*
 [File Info]
 path: src/main/java/tech/robd/lurk/ReportingConfig.java
 description: Immutable reporting configuration. Every field is optional and unset fields fall back to the defaults one by one.
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

import java.io.PrintStream;

/**
 * How results get reported.
 *
 * <p>Install one with {@link ResultReporter#setConfiguration(ReportingConfig)} (or
 * {@link Lurk#setConfiguration(ReportingConfig)} for the process-wide reporter). Any field left
 * {@code null} is <em>unset</em> and falls back to the default for that field alone, so a config
 * that only names the project keeps the default prefix, postfix, flags, handlers and streams.
 *
 * <table>
 *   <caption>Fields and defaults</caption>
 *   <tr><th>field</th><th>default</th></tr>
 *   <tr><td>{@code projectName}</td><td>{@code "lurk"}; {@code ""} means no tag at all</td></tr>
 *   <tr><td>{@code prefix}</td><td>{@code ""}, written before the message (after time, result and tag)</td></tr>
 *   <tr><td>{@code postfix}</td><td>{@code "\n"}, written after the message</td></tr>
 *   <tr><td>{@code logEnabled}</td><td>{@code true}</td></tr>
 *   <tr><td>{@code errEnabled}</td><td>{@code true}</td></tr>
 *   <tr><td>{@code logHandler}</td><td>built-in reporter writing to {@code out}</td></tr>
 *   <tr><td>{@code errorHandler}</td><td>built-in reporter writing to {@code err}</td></tr>
 *   <tr><td>{@code out}</td><td>{@link System#out} at the time of writing</td></tr>
 *   <tr><td>{@code err}</td><td>{@link System#err} at the time of writing</td></tr>
 * </table>
 *
 * <pre>{@code
 * Lurk.setConfiguration(ReportingConfig.builder()
 *         .projectName("queue")
 *         .prefix("-- ")
 *         .build());
 * }</pre>
 *
 * @param projectName  tag written in brackets, or {@code null} for the default
 * @param prefix       text before the message, or {@code null} for the default
 * @param postfix      text after the message, or {@code null} for the default
 * @param logEnabled   whether the log channel writes anything, or {@code null} for the default
 * @param errEnabled   whether the error channel writes anything, or {@code null} for the default
 * @param logHandler   custom log channel handler, or {@code null} for the built-in one
 * @param errorHandler custom error channel handler, or {@code null} for the built-in one
 * @param out          stream for the built-in log reporter, or {@code null} for {@link System#out}
 * @param err          stream for the built-in error reporter, or {@code null} for {@link System#err}
 * @author Rob Deas
 * @since 0.1.0
 */
public record ReportingConfig(
        @Nullable String projectName,
        @Nullable String prefix,
        @Nullable String postfix,
        @Nullable Boolean logEnabled,
        @Nullable Boolean errEnabled,
        @Nullable LogHandler logHandler,
        @Nullable ErrorHandler errorHandler,
        @Nullable PrintStream out,
        @Nullable PrintStream err) {

    // 🧩 Section: defaults
    public static final String DEFAULT_PROJECT_NAME = "lurk";
    public static final String DEFAULT_PREFIX = "";
    public static final String DEFAULT_POSTFIX = "\n";
    // [/🧩 Section: defaults]

    private static final ReportingConfig EMPTY = builder().build();

    /**
     * @return a config with every field unset
     */
    public static ReportingConfig empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this config's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .projectName(projectName)
                .prefix(prefix)
                .postfix(postfix)
                .logEnabled(logEnabled)
                .errEnabled(errEnabled)
                .logHandler(logHandler)
                .errorHandler(errorHandler)
                .out(out)
                .err(err);
    }

    // 🧩 Section: builder

    /**
     * Mutable builder. Setting a field to {@code null} marks it unset again.
     * Also the destination type for {@link ResultReporter#getDefaults(Builder)}.
     */
    public static final class Builder {
        private @Nullable String projectName;
        private @Nullable String prefix;
        private @Nullable String postfix;
        private @Nullable Boolean logEnabled;
        private @Nullable Boolean errEnabled;
        private @Nullable LogHandler logHandler;
        private @Nullable ErrorHandler errorHandler;
        private @Nullable PrintStream out;
        private @Nullable PrintStream err;

        private Builder() {
        }

        public Builder projectName(@Nullable String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder prefix(@Nullable String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder postfix(@Nullable String postfix) {
            this.postfix = postfix;
            return this;
        }

        public Builder logEnabled(@Nullable Boolean logEnabled) {
            this.logEnabled = logEnabled;
            return this;
        }

        public Builder errEnabled(@Nullable Boolean errEnabled) {
            this.errEnabled = errEnabled;
            return this;
        }

        public Builder logHandler(@Nullable LogHandler logHandler) {
            this.logHandler = logHandler;
            return this;
        }

        public Builder errorHandler(@Nullable ErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public Builder out(@Nullable PrintStream out) {
            this.out = out;
            return this;
        }

        public Builder err(@Nullable PrintStream err) {
            this.err = err;
            return this;
        }

        /**
         * Copy every field of {@code source} into this builder, unset fields included.
         */
        Builder copyFrom(ReportingConfig source) {
            this.projectName = source.projectName();
            this.prefix = source.prefix();
            this.postfix = source.postfix();
            this.logEnabled = source.logEnabled();
            this.errEnabled = source.errEnabled();
            this.logHandler = source.logHandler();
            this.errorHandler = source.errorHandler();
            this.out = source.out();
            this.err = source.err();
            return this;
        }

        public ReportingConfig build() {
            return new ReportingConfig(projectName, prefix, postfix, logEnabled, errEnabled,
                    logHandler, errorHandler, out, err);
        }
    }
    // [/🧩 Section: builder]
}
