/*
 [File Info]
 path: src/main/java/tech/robd/lurk/ResultKind.java
 description: Enum view over the named (non-boolean) results, with code lookup.
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

import java.util.Optional;

/**
 * The named results from {@link Results} as an enum.
 * <p>
 * The boolean results are left out on purpose: {@code TRUE} and {@code FALSE} share their codes
 * with {@link #FAILURE} and {@link #SUCCESS}, and a code alone cannot say which axis it belongs to.
 * {@link #VALID_OBJECT} is present but is never returned by {@link #fromCode(int)}.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public enum ResultKind {
    INVALID_OBJECT(Results.INVALID_OBJECT),
    INTERNAL_ERROR(Results.INTERNAL_ERROR),
    BAD_PARAM(Results.BAD_PARAM),
    SUCCESS(Results.SUCCESS),
    FAILURE(Results.FAILURE),
    DONE(Results.DONE),
    VALID_OBJECT(Results.VALID_OBJECT);

    private final int code;

    ResultKind(int code) {
        this.code = code;
    }

    /**
     * @return the integer value of this result
     */
    public int code() {
        return code;
    }

    public ResultCategory category() {
        return Results.category(code);
    }

    /**
     * @return {@code true} if this kind's code equals {@code result}
     */
    public boolean matches(int result) {
        return code == result;
    }

    /**
     * Canonical kind for a code. {@code 0} resolves to {@link #SUCCESS}, never to
     * {@link #VALID_OBJECT}. Unnamed values (including unnamed negatives) are empty.
     */
    public static Optional<ResultKind> fromCode(int result) {
        for (ResultKind k : values()) {
            if (k != VALID_OBJECT && k.code == result) return Optional.of(k);
        }
        return Optional.empty();
    }
}
