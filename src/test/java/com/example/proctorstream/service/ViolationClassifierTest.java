package com.example.proctorstream.service;

import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.model.BehaviorEvent;
import com.example.proctorstream.model.BehaviorKind;
import com.example.proctorstream.model.RawDetection;
import com.example.proctorstream.model.Severity;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.model.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ViolationClassifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ViolationClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ViolationClassifier(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static BehaviorEvent behavior(BehaviorKind kind, Map<String, Object> payload) {
        return BehaviorEvent.builder()
                .sessionId("session-1")
                .ownerId("student-1")
                .kind(kind)
                .payload(payload)
                .build();
    }

    private static RawDetection detection(String type, Double confidence) {
        return RawDetection.builder()
                .sessionId("session-1")
                .type(type)
                .confidence(confidence)
                .details("seen by camera")
                .timestamp(NOW.toEpochMilli())
                .build();
    }

    @Test
    void testClassify_TabSwitch() {
        // When
        List<Violation> violations = classifier.classify(behavior(BehaviorKind.TAB_SWITCH, Map.of()));

        // Then
        assertEquals(1, violations.size());
        Violation v = violations.get(0);
        assertEquals(ViolationType.TAB_SWITCH, v.getType());
        assertEquals(0.9, v.getConfidence());
        assertEquals(Severity.CRITICAL, v.severity());
        assertEquals("session-1", v.getSessionId());
        assertEquals("student-1", v.getOwnerId());
        assertEquals(NOW, v.getDetectedAt());
    }

    @Test
    void testClassify_CopyPaste() {
        // When
        List<Violation> violations = classifier.classify(behavior(BehaviorKind.COPY_PASTE, Map.of()));

        // Then
        assertEquals(ViolationType.COPY_PASTE, violations.get(0).getType());
        assertEquals(0.95, violations.get(0).getConfidence());
    }

    @Test
    void testClassify_RightClickOnlyOnTextSelection() {
        // When
        List<Violation> onText = classifier.classify(behavior(BehaviorKind.RIGHT_CLICK, Map.of("context", "text_selection")));
        List<Violation> elsewhere = classifier.classify(behavior(BehaviorKind.RIGHT_CLICK, Map.of("context", "image")));

        // Then
        assertEquals(1, onText.size());
        assertEquals(ViolationType.SUSPICIOUS_INTERACTION, onText.get(0).getType());
        assertEquals(0.6, onText.get(0).getConfidence());
        assertTrue(elsewhere.isEmpty());
    }

    @Test
    void testClassify_KeyCombination() {
        // When
        List<Violation> copy = classifier.classify(behavior(BehaviorKind.KEY_COMBINATION, Map.of("keys", List.of("Ctrl", "C"))));
        List<Violation> paste = classifier.classify(behavior(BehaviorKind.KEY_COMBINATION, Map.of("keys", List.of("ctrl", "v"))));
        List<Violation> other = classifier.classify(behavior(BehaviorKind.KEY_COMBINATION, Map.of("keys", List.of("ctrl", "s"))));
        List<Violation> noKeys = classifier.classify(behavior(BehaviorKind.KEY_COMBINATION, Map.of()));

        // Then
        assertEquals(ViolationType.COPY_PASTE_SHORTCUT, copy.get(0).getType());
        assertEquals(0.8, copy.get(0).getConfidence());
        assertEquals(1, paste.size());
        assertTrue(other.isEmpty());
        assertTrue(noKeys.isEmpty());
    }

    @Test
    void testClassify_WindowBlurAndFullscreenExit() {
        // When
        Violation blur = classifier.classify(behavior(BehaviorKind.WINDOW_BLUR, Map.of())).get(0);
        Violation fullscreen = classifier.classify(behavior(BehaviorKind.FULLSCREEN_EXIT, Map.of())).get(0);

        // Then
        assertEquals(ViolationType.WINDOW_FOCUS_LOST, blur.getType());
        assertEquals(0.7, blur.getConfidence());
        assertEquals(Severity.HIGH, blur.severity());
        assertEquals(ViolationType.FULLSCREEN_VIOLATION, fullscreen.getType());
        assertEquals(0.8, fullscreen.getConfidence());
    }

    @Test
    void testClassify_UnknownKindYieldsNothing() {
        // When
        List<Violation> violations = classifier.classify(behavior(null, Map.of()));

        // Then
        assertTrue(violations.isEmpty());
    }

    @Test
    void testClassify_UsesClientTimestampWhenPresent() {
        // Given
        Instant sent = NOW.minusSeconds(5);
        BehaviorEvent event = BehaviorEvent.builder()
                .sessionId("session-1")
                .ownerId("student-1")
                .kind(BehaviorKind.TAB_SWITCH)
                .payload(Map.of())
                .clientTimestamp(sent)
                .build();

        // When
        Violation v = classifier.classify(event).get(0);

        // Then
        assertEquals(sent, v.getDetectedAt());
    }

    @Test
    void testNormalize_KnownType() {
        // Given
        RawDetection d = detection("Multiple_Faces", 0.55);
        d.setScreenshot("https://evidence/1.png");

        // When
        Violation v = classifier.normalize(d, "student-1");

        // Then
        assertEquals(ViolationType.MULTIPLE_FACES, v.getType());
        assertEquals("multiple_faces", v.getRawType());
        assertEquals(Severity.CRITICAL, v.severity());
        assertEquals("https://evidence/1.png", v.getEvidenceUrl());
        assertEquals("seen by camera", v.getDetail());
        assertEquals(NOW, v.getDetectedAt());
        assertNotNull(v.getId());
    }

    @Test
    void testNormalize_UnknownTypeBucketedOnConfidence() {
        // When
        Violation high = classifier.normalize(detection("earbuds", 0.75), "student-1");
        Violation low = classifier.normalize(detection("earbuds", 0.2), "student-1");

        // Then
        assertEquals(ViolationType.OTHER, high.getType());
        assertEquals("earbuds", high.getRawType());
        assertEquals(Severity.HIGH, high.severity());
        assertEquals(Severity.LOW, low.severity());
        assertEquals("earbuds", high.toMap().get("type"));
    }

    @Test
    void testNormalize_RejectsMissingConfidence() {
        // When
        ProctorException e = assertThrows(ProctorException.class,
                () -> classifier.normalize(detection("phone_detected", null), "student-1"));

        // Then
        assertEquals(ErrorCode.INVALID_INPUT, e.getCode());
    }

    @Test
    void testNormalize_RejectsConfidenceOutOfRange() {
        // When / Then
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(ProctorException.class,
                () -> classifier.normalize(detection("phone_detected", 1.5), "student-1")).getCode());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(ProctorException.class,
                () -> classifier.normalize(detection("phone_detected", -0.1), "student-1")).getCode());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(ProctorException.class,
                () -> classifier.normalize(detection("phone_detected", Double.NaN), "student-1")).getCode());
    }

    @Test
    void testNormalize_RejectsMissingFields() {
        // Given
        RawDetection noSession = detection("phone_detected", 0.8);
        noSession.setSessionId(" ");
        RawDetection noType = detection(null, 0.8);
        RawDetection noTimestamp = detection("phone_detected", 0.8);
        noTimestamp.setTimestamp(null);

        // When / Then
        assertThrows(ProctorException.class, () -> classifier.normalize(noSession, "student-1"));
        assertThrows(ProctorException.class, () -> classifier.normalize(noType, "student-1"));
        assertThrows(ProctorException.class, () -> classifier.normalize(noTimestamp, "student-1"));
        assertThrows(ProctorException.class, () -> classifier.normalize(null, "student-1"));
    }

    @Test
    void testSeverity_TakesHigherOfListedAndConfidenceBucket() {
        assertEquals(Severity.CRITICAL, ViolationClassifier.severity(ViolationType.COPY_PASTE, 0.1));
        assertEquals(Severity.CRITICAL, ViolationClassifier.severity(ViolationType.BOOK_DETECTED, 0.95));
        assertEquals(Severity.MEDIUM, ViolationClassifier.severity(ViolationType.GAZE_DEVIATION, 0.3));
        assertEquals(Severity.HIGH, ViolationClassifier.severity(ViolationType.GAZE_DEVIATION, 0.7));
        assertEquals(Severity.LOW, ViolationClassifier.severity(ViolationType.LAPTOP_DETECTED, 0.49));
    }
}
