/*
 [File Info]
 path: src/test/java/tech/robd/lurk/handlers/Slf4jHandlersTest.java
 description: Tests for the SLF4J bridge handlers using slf4j's event-recording substitute logger.
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
package tech.robd.lurk.handlers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;
import org.slf4j.event.SubstituteLoggingEvent;
import org.slf4j.helpers.SubstituteLogger;
import tech.robd.lurk.ReportingConfig;
import tech.robd.lurk.ResultReporter;
import tech.robd.lurk.Results;
import tech.robd.lurk.tools.CapturingStream;

import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class Slf4jHandlersTest {

    private LinkedBlockingQueue<SubstituteLoggingEvent> events;
    private SubstituteLogger logger;

    @BeforeEach
    void setUp() {
        events = new LinkedBlockingQueue<>();
        // no delegate + not post-initialisation: every call is recorded into the queue
        logger = new SubstituteLogger("lurk-test", events, false);
    }

    @Test
    void logHandler_statusAtInfo_errorAtWarn() {
        Slf4jHandlers.logHandler(logger).log(Results.DONE, "finished");
        Slf4jHandlers.logHandler(logger).log(-99, "odd");

        SubstituteLoggingEvent first = events.poll();
        assertNotNull(first);
        assertEquals(Level.INFO, first.getLevel());
        assertEquals("[{}] {}", first.getMessage());
        assertArrayEquals(new Object[]{"DONE", "finished"}, first.getArgumentArray());

        SubstituteLoggingEvent second = events.poll();
        assertNotNull(second);
        assertEquals(Level.WARN, second.getLevel());
        assertArrayEquals(new Object[]{"0xffffff9d", "odd"}, second.getArgumentArray());
    }

    @Test
    void errorHandler_atError_withPlaceholders() {
        Slf4jHandlers.errorHandler(logger).error(Results.BAD_PARAM, null, null, "bad arg");

        SubstituteLoggingEvent e = events.poll();
        assertNotNull(e);
        assertEquals(Level.ERROR, e.getLevel());
        assertEquals("[{}] {}.{}: {}", e.getMessage());
        assertArrayEquals(new Object[]{"BAD_PARAM", "(unknown)", "???", "bad arg"}, e.getArgumentArray());
    }

    @Test
        // Wired through a reporter: lines go to SLF4J, nothing to the streams; flags still apply.
    void configFor_routesBothChannels() {
        CapturingStream out = new CapturingStream();
        CapturingStream err = new CapturingStream();
        ResultReporter reporter = new ResultReporter();
        reporter.setConfiguration(Slf4jHandlers.configFor(logger).toBuilder().out(out).err(err).build());

        assertEquals(Results.FAILURE, reporter.report(Results.FAILURE, "queue %s", "empty"));
        assertEquals(Results.INTERNAL_ERROR, reporter.reportError(Results.INTERNAL_ERROR, "run", "3", "boom"));

        assertEquals(2, events.size());
        assertTrue(out.isEmpty());
        assertTrue(err.isEmpty());

        reporter.setConfiguration(Slf4jHandlers.configFor(logger).toBuilder().logEnabled(false).build());
        reporter.report(Results.FAILURE, "dropped");
        assertEquals(2, events.size());
    }

    @Test
    void configFor_leavesOtherFieldsUnset() {
        ReportingConfig cfg = Slf4jHandlers.configFor("lurk-test");

        assertNotNull(cfg.logHandler());
        assertNotNull(cfg.errorHandler());
        assertNull(cfg.projectName());
        assertNull(cfg.logEnabled());
        assertNull(cfg.out());
    }

    @Test
    void nullLogger_failsFast() {
        assertThrows(NullPointerException.class, () -> Slf4jHandlers.logHandler(null));
        assertThrows(NullPointerException.class, () -> Slf4jHandlers.errorHandler(null));
    }
}
