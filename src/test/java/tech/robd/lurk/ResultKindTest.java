/*
 [File Info]
 path: src/test/java/tech/robd/lurk/ResultKindTest.java
 description: Tests for ResultKind code lookup and categories.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ResultKindTest {

    @Test
    void fromCode_returnsCanonicalKind() {
        assertEquals(Optional.of(ResultKind.BAD_PARAM), ResultKind.fromCode(-1));
        assertEquals(Optional.of(ResultKind.INVALID_OBJECT), ResultKind.fromCode(-2));
        assertEquals(Optional.of(ResultKind.INTERNAL_ERROR), ResultKind.fromCode(-3));
        assertEquals(Optional.of(ResultKind.FAILURE), ResultKind.fromCode(1));
        assertEquals(Optional.of(ResultKind.DONE), ResultKind.fromCode(2));
    }

    @Test
        // 0 is both SUCCESS and VALID_OBJECT; lookup always answers SUCCESS.
    void fromCode_zero_isSuccessNotValidObject() {
        assertEquals(Optional.of(ResultKind.SUCCESS), ResultKind.fromCode(0));
        assertTrue(ResultKind.VALID_OBJECT.matches(0));
    }

    @Test
    void fromCode_unnamed_isEmpty() {
        assertTrue(ResultKind.fromCode(-4).isEmpty());
        assertTrue(ResultKind.fromCode(3).isEmpty());
    }

    @Test
    void errorKinds_areExactlyTheLurkErrors() {
        for (ResultKind k : ResultKind.values()) {
            assertEquals(k.category() == ResultCategory.ERROR, Results.isLurkError(k.code()), k.name());
        }
    }
}
