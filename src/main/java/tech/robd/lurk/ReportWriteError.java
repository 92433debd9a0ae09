/*
 [File Info]
 path: src/main/java/tech/robd/lurk/ReportWriteError.java
 description: Fatal error raised when a built-in reporter cannot write its line to the output stream.
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

import java.util.Locale;

/**
 * Thrown when a built-in reporter fails to write a result line.
 * <p>
 * A failed write is treated as unrecoverable, so this is an {@link Error}. Applications that
 * want to keep running anyway can catch it at their outermost boundary.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class ReportWriteError extends Error {

    private static final long serialVersionUID = 1L;

    private final int result;

    /**
     * @param channel {@code "log"} or {@code "err"}
     * @param result  the result whose line could not be written
     */
    public ReportWriteError(String channel, int result) {
        super(String.format(Locale.ROOT, "Failed to write %s line for result [%08x]", channel, result));
        this.result = result;
    }

    /**
     * @return the result that was being reported
     */
    public int result() {
        return result;
    }
}
