/*
 [File Info]
 path: src/main/java/tech/robd/lurk/Results.java
 description: Integer result constants (errors, success, statuses, booleans) and the pure predicates that classify them.
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
 * Common results returned as plain {@code int}s.
 *
 * <p>Results fall into four groups:
 * <ul>
 *   <li><b>errors</b> – always negative; something unexpected happened or a value is invalid,</li>
 *   <li><b>success</b> – exactly zero,</li>
 *   <li><b>statuses</b> – always positive; e.g. {@link #FAILURE} or {@link #DONE},</li>
 *   <li><b>booleans</b> – {@link #TRUE}/{@link #FALSE}, numerically {@code 1}/{@code 0}.</li>
 * </ul>
 *
 * <p>A <em>failure</em> is not an error. Dequeuing from an empty queue is a {@link #FAILURE};
 * being handed a {@code null} queue is a {@link #BAD_PARAM}.
 *
 * <p><strong>Boolean results collide with other results.</strong> {@code FALSE == SUCCESS ==
 * VALID_OBJECT == 0} and {@code TRUE == FAILURE == 1}. Nothing in this class can tell them
 * apart. A method returning a boolean result must say so in its documentation, and callers must
 * never compare a boolean result against a status or success result.
 *
 * <pre>{@code
 * int dequeue(Queue q) {
 *     if (q == null) return Returns.badParamNull("q");
 *     if (q.isEmpty()) return Results.FAILURE;
 *     ...
 *     return Results.SUCCESS;
 * }
 * }</pre>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Results {

    // 🧩 Section: errors

    /** An object (typically a value passed in) failed validation. */
    public static final int INVALID_OBJECT = -2;

    /** Internal bug or unexpected state. */
    public static final int INTERNAL_ERROR = -3;

    /** A parameter passed by the caller is invalid. */
    public static final int BAD_PARAM = -1;
    // [/🧩 Section: errors]

    // 🧩 Section: success-and-statuses

    /** Successful execution. */
    public static final int SUCCESS = 0;

    /** A failure that is not an error, e.g. nothing to dequeue. */
    public static final int FAILURE = 1;

    /** An iterator or ongoing process has finished. */
    public static final int DONE = 2;

    /** Same value as {@link #SUCCESS}; reads better next to {@link #INVALID_OBJECT}. */
    public static final int VALID_OBJECT = SUCCESS;
    // [/🧩 Section: success-and-statuses]

    // 🧩 Section: booleans

    /** Boolean true. Equal to {@link #FAILURE}; see the class notes. */
    public static final int TRUE = 1;

    /** Boolean false. Equal to {@link #SUCCESS}; see the class notes. */
    public static final int FALSE = 0;
    // [/🧩 Section: booleans]

    private Results() {
    }

    // 🧩 Section: predicates

    /**
     * @return {@code true} only if {@code result} is exactly {@link #SUCCESS}
     * (and therefore also for {@link #FALSE} and {@link #VALID_OBJECT})
     */
    public static boolean isSuccess(int result) {
        return result == SUCCESS;
    }

    /**
     * @return {@code true} only if {@code result} is exactly {@link #VALID_OBJECT}
     */
    public static boolean isValidObject(int result) {
        return result == VALID_OBJECT;
    }

    /**
     * Any negative value is an error, whether or not it is one of the named errors here.
     *
     * @return {@code true} when {@code result < 0}
     */
    public static boolean isError(int result) {
        return result < 0;
    }

    /**
     * Membership in the named error set. A library defining its own negative results
     * gets {@code false} here but {@code true} from {@link #isError(int)}.
     *
     * @return {@code true} only for {@link #INVALID_OBJECT}, {@link #INTERNAL_ERROR} and {@link #BAD_PARAM}
     */
    public static boolean isLurkError(int result) {
        switch (result) {
            case INVALID_OBJECT:
            case INTERNAL_ERROR:
            case BAD_PARAM:
                return true;
            default:
                return false;
        }
    }

    /** @return {@code true} when {@code result > 0} */
    public static boolean isStatus(int result) {
        return result > 0;
    }

    /** @return {@code true} only if {@code result} is exactly {@link #TRUE} */
    public static boolean isTrue(int result) {
        return result == TRUE;
    }

    /** @return {@code true} only if {@code result} is exactly {@link #FALSE} */
    public static boolean isFalse(int result) {
        return result == FALSE;
    }
    // [/🧩 Section: predicates]

    // 🧩 Section: describe

    /**
     * Category by sign. Booleans have no category of their own; they are not distinguishable here.
     */
    public static ResultCategory category(int result) {
        if (result < 0) return ResultCategory.ERROR;
        if (result == 0) return ResultCategory.SUCCESS;
        return ResultCategory.STATUS;
    }

    /**
     * Human-readable form: the canonical {@link ResultKind} name when the value is named,
     * otherwise the same 8-digit hex the default reporters print.
     */
    public static String describe(int result) {
        return ResultKind.fromCode(result)
                .map(ResultKind::name)
                .orElseGet(() -> String.format(Locale.ROOT, "0x%08x", result));
    }
    // [/🧩 Section: describe]
}
