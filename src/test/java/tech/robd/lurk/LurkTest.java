/*
 [File Info]
 path: src/test/java/tech/robd/lurk/LurkTest.java
 description: Tests for the process-wide facade against the real System.out/System.err.
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.robd.lurk.tools.CapturingStream;

import java.io.PrintStream;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class LurkTest {

    private static final Pattern LOG_LINE =
            Pattern.compile("\\d{2}:\\d{2}:\\d{2}  00000001  \\[lurk]  queue empty");

    private PrintStream originalOut;
    private PrintStream originalErr;
    private CapturingStream out;
    private CapturingStream err;

    @BeforeEach
    void redirect() {
        originalOut = System.out;
        originalErr = System.err;
        out = new CapturingStream();
        err = new CapturingStream();
        System.setOut(out);
        System.setErr(err);
        Lurk.setConfiguration(null);
    }

    @AfterEach
    void restore() {
        Lurk.setConfiguration(null);
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
        // No configuration ever installed: lines go to System.out / System.err.
    void defaults_writeToSystemStreams() {
        assertEquals(Results.FAILURE, Lurk.report(Results.FAILURE, "queue empty"));
        assertEquals(Results.BAD_PARAM, Lurk.reportError(Results.BAD_PARAM, null, null, "bad arg"));

        assertEquals(1, out.lines().size());
        assertTrue(LOG_LINE.matcher(out.lines().get(0)).matches(), out.text());
        assertTrue(err.text().contains("[lurk:(unknown).???]  bad arg"), err.text());
    }

    @Test
        // Log channel off: nothing written, result still handed back.
    void disabledLogChannel_isSilent() {
        Lurk.setConfiguration(ReportingConfig.builder().logEnabled(false).build());

        assertEquals(Results.DONE, Lurk.report(Results.DONE, "done"));
        assertEquals(-12345, Lurk.report(-12345, "%s", "x"));

        assertTrue(out.isEmpty());
    }

    @Test
    void facade_sharesOneReporter() {
        ReportingConfig cfg = ReportingConfig.builder().projectName("shared").build();
        Lurk.setConfiguration(cfg);

        assertSame(cfg, Lurk.reporter().configuration());
        assertSame(Lurk.reporter(), Lurk.reporter());
    }

    @Test
    void getDefaults_throughFacade() {
        assertEquals(Results.BAD_PARAM, Lurk.getDefaults(null));

        ReportingConfig.Builder b = ReportingConfig.builder();
        assertEquals(Results.SUCCESS, Lurk.getDefaults(b));
        assertEquals(ReportingConfig.DEFAULT_PROJECT_NAME, b.build().projectName());
        assertTrue(out.isEmpty());
        assertTrue(err.isEmpty());
    }
}
