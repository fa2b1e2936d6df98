package com.dcruver.litsync.extract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextQualityCheckTest {

    private static final String PROSE = "Deep learning allows computational models that are composed of multiple "
        + "processing layers to learn representations of data with multiple levels of abstraction. These methods "
        + "have dramatically improved the state of the art in speech recognition and object detection.";

    @Test
    void testAcceptsOrdinaryProse() {
        assertNull(TextQualityCheck.rejectionReason(PROSE));
        double confidence = TextQualityCheck.confidence(PROSE);
        assertTrue(confidence > 0.5 && confidence <= 1.0);
    }

    @Test
    void testRejectsShortText() {
        assertTrue(TextQualityCheck.rejectionReason("Abstract").startsWith("too short"));
        assertTrue(TextQualityCheck.rejectionReason(null).startsWith("too short"));
    }

    @Test
    void testRejectsNonAsciiGarbage() {
        String garbage = "\u0080\u0081\u0082\u0083 ".repeat(60);
        assertTrue(TextQualityCheck.rejectionReason(garbage).startsWith("failed validation"));
    }

    @Test
    void testRejectsRunTogetherText() {
        String glued = "a".repeat(40) + " " + "b".repeat(40) + " " + "c".repeat(40);
        assertNotNull(TextQualityCheck.rejectionReason(glued));
    }

    @Test
    void testRejectsTextWithoutSentences() {
        String words = "alpha beta gamma delta ".repeat(10);
        assertEquals("no sentence structure", TextQualityCheck.rejectionReason(words));
    }
}
