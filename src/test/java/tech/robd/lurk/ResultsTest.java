/*
 [File Info]
 path: src/test/java/tech/robd/lurk/ResultsTest.java
 description: Tests for the result constants, their sign invariants and the classification predicates.
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
 * You may not use this file except in compliance with the License.
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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResultsTest {

    private static final int[] SAMPLES = {
            Integer.MIN_VALUE, -1_000_000, -4, -3, -2, -1, 0, 1, 2, 3, 42, Integer.MAX_VALUE
    };

    /* ---------- constants ---------- */

    @Test
        // Errors negative, success zero, statuses positive.
    void constants_followSignRules() {
        assertTrue(Results.INVALID_OBJECT < 0);
        assertTrue(Results.INTERNAL_ERROR < 0);
        assertTrue(Results.BAD_PARAM < 0);
        assertEquals(0, Results.SUCCESS);
        assertTrue(Results.FAILURE > 0);
        assertTrue(Results.DONE > 0);
    }

    @Test
        // The boolean collisions are documented behaviour, not accidents to be fixed.
    void booleans_collideWithSuccessAndFailure() {
        assertEquals(Results.SUCCESS, Results.VALID_OBJECT);
        assertEquals(Results.SUCCESS, Results.FALSE);
        assertEquals(Results.FAILURE, Results.TRUE);
    }

    /* ---------- isError / isLurkError ---------- */

    @Test
    void isError_trueForEveryNegative_falseOtherwise() {
        for (int r : SAMPLES) {
            assertEquals(r < 0, Results.isError(r), "isError(" + r + ")");
        }
    }

    @Test
    void isLurkError_onlyForTheThreeNamedErrors() {
        assertTrue(Results.isLurkError(Results.INVALID_OBJECT));
        assertTrue(Results.isLurkError(Results.INTERNAL_ERROR));
        assertTrue(Results.isLurkError(Results.BAD_PARAM));

        for (int r : new int[]{-4, -1_000_000, Integer.MIN_VALUE, 0, 1, 2, Integer.MAX_VALUE}) {
            assertFalse(Results.isLurkError(r), "isLurkError(" + r + ")");
        }
    }

    @Test
        // An unnamed negative is an error but not a named one.
    void unnamedNegative_isErrorButNotLurkError() {
        assertTrue(Results.isError(-99));
        assertFalse(Results.isLurkError(-99));
    }

    /* ---------- success / valid object ---------- */

    @Test
    void isSuccess_andIsValidObject_shareTheirTruthTable() {
        assertTrue(Results.isSuccess(0));
        assertTrue(Results.isValidObject(0));
        for (int r : SAMPLES) {
            assertEquals(Results.isSuccess(r), Results.isValidObject(r));
            if (r != 0) assertFalse(Results.isSuccess(r));
        }
    }

    /* ---------- booleans ---------- */

    @Test
    void isTrue_isFalse_exactAndMutuallyExclusive() {
        assertTrue(Results.isTrue(Results.TRUE));
        assertFalse(Results.isFalse(Results.TRUE));
        assertTrue(Results.isFalse(Results.FALSE));
        assertFalse(Results.isTrue(Results.FALSE));

        assertFalse(Results.isTrue(2));
        assertFalse(Results.isTrue(-1));
        assertFalse(Results.isFalse(-1));
    }

    /* ---------- category / describe ---------- */

    @Test
    void category_bySign() {
        assertEquals(ResultCategory.ERROR, Results.category(-7));
        assertEquals(ResultCategory.SUCCESS, Results.category(0));
        assertEquals(ResultCategory.STATUS, Results.category(Results.DONE));
        assertTrue(Results.isStatus(Results.DONE));
        assertFalse(Results.isStatus(Results.SUCCESS));
    }

    @Test
    void describe_namesKnownResults_hexForOthers() {
        assertEquals("BAD_PARAM", Results.describe(Results.BAD_PARAM));
        assertEquals("SUCCESS", Results.describe(Results.VALID_OBJECT));
        assertEquals("DONE", Results.describe(Results.DONE));
        assertEquals("0xffffff9d", Results.describe(-99));
        assertEquals("0x0000002a", Results.describe(42));
    }
}
