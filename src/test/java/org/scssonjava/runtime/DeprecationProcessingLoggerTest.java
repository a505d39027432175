package org.scssonjava.runtime;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DeprecationProcessingLoggerTest {

    private static final Set<Deprecation> NONE = EnumSet.noneOf(Deprecation.class);
    private static final Set<Deprecation> ELSEIF = EnumSet.of(Deprecation.ELSEIF);

    @Test
    public void testForwardsWarnings() {
        RecordingLogger inner = new RecordingLogger();
        Logger logger = new DeprecationProcessingLogger(inner, NONE, NONE, true);
        logger.warn("plain", null, null);
        logger.warnForDeprecation(Deprecation.ELSEIF, "deprecated", null);
        assertEquals(2, inner.warnings.size());
        assertNull(inner.warnings.get(0).deprecation);
        assertEquals(Deprecation.ELSEIF, inner.warnings.get(1).deprecation);
    }

    @Test
    public void testSilencedDeprecationIsDropped() {
        RecordingLogger inner = new RecordingLogger();
        Logger logger = new DeprecationProcessingLogger(inner, ELSEIF, NONE, true);
        logger.warnForDeprecation(Deprecation.ELSEIF, "deprecated", null);
        assertTrue(inner.warnings.isEmpty());
    }

    @Test
    public void testFatalDeprecationThrows() {
        RecordingLogger inner = new RecordingLogger();
        Logger logger = new DeprecationProcessingLogger(inner, NONE, ELSEIF, true);
        ScssCompilerException e = assertThrows(ScssCompilerException.class,
                () -> logger.warnForDeprecation(Deprecation.ELSEIF, "deprecated", null));
        assertTrue(e.getRawMessage().startsWith("deprecated\n\nThis is only an error because you've set the elseif deprecation to be fatal."));
        assertTrue(inner.warnings.isEmpty());
    }

    @Test
    public void testSilencedAndFatalIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DeprecationProcessingLogger(new RecordingLogger(), ELSEIF, ELSEIF, true));
    }

    @Test
    public void testRepetitionsAreLimited() {
        RecordingLogger inner = new RecordingLogger();
        DeprecationProcessingLogger logger = new DeprecationProcessingLogger(inner, NONE, NONE, true);
        for (int i = 0; i < 7; i++) {
            logger.warnForDeprecation(Deprecation.ELSEIF, "deprecated", null);
        }
        assertEquals(DeprecationProcessingLogger.MAX_REPETITIONS, inner.warnings.size());
        assertEquals(2, logger.getOmittedCount());

        logger.summarize();
        RecordingLogger.Warning summary = inner.warnings.get(inner.warnings.size() - 1);
        assertTrue(summary.message.startsWith("2 repetitive deprecation warnings omitted."));
        assertNull(summary.deprecation);
    }

    @Test
    public void testVerboseKeepsAllRepetitions() {
        RecordingLogger inner = new RecordingLogger();
        DeprecationProcessingLogger logger = new DeprecationProcessingLogger(inner, NONE, NONE, false);
        for (int i = 0; i < 7; i++) {
            logger.warnForDeprecation(Deprecation.ELSEIF, "deprecated", null);
        }
        assertEquals(7, inner.warnings.size());
        logger.summarize();
        assertEquals(7, inner.warnings.size());
    }

    @Test
    public void testDeprecationIds() {
        assertEquals(Deprecation.ELSEIF, Deprecation.fromId("elseif"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Deprecation.fromId("nope"));
        assertEquals("Invalid deprecation \"nope\".", e.getMessage());
    }
}
