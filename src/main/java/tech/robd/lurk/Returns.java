/*
 [File Info]
 path: src/main/java/tech/robd/lurk/Returns.java
 description: Call-site helpers that report a result on the error channel with the caller's name and line,
              then hand the result back for returning (trace, bad parameter, invalid object, guards).
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

import java.util.function.ToIntFunction;

/**
 * "Report and return" helpers for the process-wide reporter.
 *
 * <p>Every helper reports on the error channel via {@link Lurk#reportError}, filling in the
 * calling method's name and line number ({@link CallSite#capture(Class[])}), and returns the
 * result so it can be returned straight away:
 *
 * <pre>{@code
 * int push(Stack s, Item item) {
 *     if (s == null) return Returns.badParamNull("s");
 *     int r = grow(s);
 *     if (Results.isError(r)) return Returns.trace(r);
 *     ...
 * }
 * }</pre>
 *
 * <p>Whether anything is written depends on the active configuration; the returned value never
 * does.
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Returns {

    private Returns() {
    }

    // 🧩 Section: trace

    /**
     * Pass an error from a callee up the stack, leaving a breadcrumb.
     *
     * @return {@code result}
     */
    public static int trace(int result) {
        return report(result, "Callback trace.");
    }

    /**
     * Like {@link #trace(int)} but also records the callee's result when returning a different one.
     *
     * @param result the result to return
     * @param pass   the result that was received
     * @return {@code result}
     */
    public static int passError(int result, int pass) {
        return report(result, "Callback trace, passing: [%08x].", pass);
    }
    // [/🧩 Section: trace]

    // 🧩 Section: parameters

    /** @return {@link Results#BAD_PARAM} */
    public static int badParam(String param) {
        return report(Results.BAD_PARAM, "Bad parameter [" + param + "].");
    }

    /** @return {@link Results#BAD_PARAM} */
    public static int badParamNull(String param) {
        return report(Results.BAD_PARAM, "Bad parameter [" + param + "]. Must not be [null]");
    }
    // [/🧩 Section: parameters]

    // 🧩 Section: objects

    /** @return {@link Results#INVALID_OBJECT} */
    public static int invalidObject(String obj) {
        return report(Results.INVALID_OBJECT, "Invalid object [" + obj + "].");
    }

    /** @return {@link Results#INVALID_OBJECT} */
    public static int invalidObjectMember(String obj, String member) {
        return report(Results.INVALID_OBJECT, "Invalid object member [" + obj + "." + member + "].");
    }

    /**
     * For several members at once; prints {@code [obj.(a, b)]}.
     *
     * @return {@link Results#INVALID_OBJECT}
     */
    public static int invalidObjectMembers(String obj, String... members) {
        return report(Results.INVALID_OBJECT,
                "Invalid object member [" + obj + ".(" + String.join(", ", members) + ")].");
    }
    // [/🧩 Section: objects]

    // 🧩 Section: general

    /** @return {@link Results#INTERNAL_ERROR} */
    public static int internalError() {
        return report(Results.INTERNAL_ERROR, "Internal error.");
    }

    /**
     * @param message written as is
     * @return {@code result}
     */
    public static int error(int result, String message) {
        return report(result, message);
    }

    /**
     * @param format {@link String#format} pattern
     * @return {@code result}
     */
    public static int errorFmt(int result, String format, Object... args) {
        return report(result, format, args);
    }
    // [/🧩 Section: general]

    // 🧩 Section: guards

    /**
     * @return {@link Results#SUCCESS} when {@code value} is non-null, else the result of
     * {@link #badParamNull(String)}
     */
    public static int nullGuard(@Nullable Object value, String name) {
        if (value != null) return Results.SUCCESS;
        return badParamNull(name);
    }

    /**
     * Run {@code validator} over {@code obj}; anything other than {@link Results#VALID_OBJECT}
     * is reported as an invalid object.
     *
     * @param validator returns {@link Results#VALID_OBJECT} for a valid object
     * @param obj       the object to check
     * @param name      how the object is named in the report
     * @return {@link Results#VALID_OBJECT} or {@link Results#INVALID_OBJECT}
     */
    public static <T> int validateObject(ToIntFunction<? super T> validator, T obj, String name) {
        if (Results.isValidObject(validator.applyAsInt(obj))) return Results.VALID_OBJECT;
        return invalidObject(name);
    }

    /**
     * Member variant of {@link #validateObject}.
     *
     * @return {@link Results#VALID_OBJECT} or {@link Results#INVALID_OBJECT}
     */
    public static <M> int validateObjectMember(ToIntFunction<? super M> validator, M member,
                                               String objName, String memberName) {
        if (Results.isValidObject(validator.applyAsInt(member))) return Results.VALID_OBJECT;
        return invalidObjectMember(objName, memberName);
    }
    // [/🧩 Section: guards]

    private static int report(int result, String format, Object... args) {
        CallSite site = CallSite.capture(Returns.class);
        return Lurk.reportError(result, site.caller(), site.location(), format, args);
    }
}
