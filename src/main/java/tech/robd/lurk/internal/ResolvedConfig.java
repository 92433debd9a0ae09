/*
 [File Info]
 path: src/main/java/tech/robd/lurk/internal/ResolvedConfig.java
 description: Fully resolved, non-null snapshot of the reporting configuration used for one dispatch.
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
package tech.robd.lurk.internal;

import tech.robd.lurk.ErrorHandler;
import tech.robd.lurk.LogHandler;

import java.io.PrintStream;

/**
 * Every field of a {@link tech.robd.lurk.ReportingConfig} with the fallbacks applied.
 * Produced by {@link ConfigResolver}; nothing in here is {@code null}.
 */
public record ResolvedConfig(
        String projectName,
        String prefix,
        String postfix,
        boolean logEnabled,
        boolean errEnabled,
        LogHandler logHandler,
        ErrorHandler errorHandler,
        PrintStream out,
        PrintStream err) {
}
