package com.example.proctorstream.service;

import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.model.BehaviorEvent;
import com.example.proctorstream.model.RawDetection;
import com.example.proctorstream.model.Severity;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.model.ViolationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns client behavior signals and pre-classified detections into {@link Violation}s.
 * Stateless apart from the clock.
 */
@Component
public class ViolationClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ViolationClassifier.class);

    private final Clock clock;

    public ViolationClassifier(Clock clock) {
        this.clock = clock;
    }

    /**
     * Behavior table. Payload shapes the table does not cover yield no violation.
     */
    public List<Violation> classify(BehaviorEvent event) {
        if (event.getKind() == null) {
            return List.of();
        }
        Map<String, Object> payload = event.getPayload() != null ? event.getPayload() : Map.of();
        switch (event.getKind()) {
            case TAB_SWITCH:
                return List.of(fromBehavior(event, ViolationType.TAB_SWITCH, 0.9, "Student switched browser tabs"));
            case COPY_PASTE:
                return List.of(fromBehavior(event, ViolationType.COPY_PASTE, 0.95, "Copy-paste activity detected"));
            case RIGHT_CLICK:
                if ("text_selection".equals(payload.get("context"))) {
                    return List.of(fromBehavior(event, ViolationType.SUSPICIOUS_INTERACTION, 0.6,
                            "Right-click on text detected"));
                }
                return List.of();
            case KEY_COMBINATION:
                if (isCopyPasteShortcut(payload.get("keys"))) {
                    return List.of(fromBehavior(event, ViolationType.COPY_PASTE_SHORTCUT, 0.8,
                            "Copy/paste keyboard shortcut detected"));
                }
                return List.of();
            case WINDOW_BLUR:
                return List.of(fromBehavior(event, ViolationType.WINDOW_FOCUS_LOST, 0.7, "Browser window lost focus"));
            case FULLSCREEN_EXIT:
                return List.of(fromBehavior(event, ViolationType.FULLSCREEN_VIOLATION, 0.8,
                        "Student exited fullscreen mode"));
            default:
                return List.of();
        }
    }

    private static boolean isCopyPasteShortcut(Object keys) {
        if (!(keys instanceof Collection)) {
            return false;
        }
        List<String> names = ((Collection<?>) keys).stream()
                .map(k -> String.valueOf(k).toLowerCase(Locale.ROOT))
                .toList();
        return names.contains("ctrl") && (names.contains("c") || names.contains("v"));
    }

    private Violation fromBehavior(BehaviorEvent event, ViolationType type, double confidence, String detail) {
        return Violation.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(event.getSessionId())
                .ownerId(event.getOwnerId())
                .type(type)
                .rawType(type.getWireName())
                .confidence(confidence)
                .detail(detail)
                .detectedAt(event.getClientTimestamp() != null ? event.getClientTimestamp() : clock.instant())
                .metadata(event.getPayload() != null ? event.getPayload() : Map.of())
                .build();
    }

    /**
     * Validates a detection and turns it into a violation.
     *
     * @throws ProctorException with {@code invalid-input} when sessionId, type, confidence or
     *         timestamp is missing, or confidence lies outside [0, 1]
     */
    public Violation normalize(RawDetection detection, String ownerId) {
        if (detection == null) {
            throw ProctorException.invalidInput("Detection payload is required");
        }
        if (isBlank(detection.getSessionId())) {
            throw ProctorException.invalidInput("sessionId is required");
        }
        if (isBlank(detection.getType())) {
            throw ProctorException.invalidInput("type is required");
        }
        Double confidence = detection.getConfidence();
        if (confidence == null) {
            throw ProctorException.invalidInput("confidence is required");
        }
        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw ProctorException.invalidInput("confidence must be between 0 and 1, got " + confidence);
        }
        if (detection.getTimestamp() == null) {
            throw ProctorException.invalidInput("timestamp is required");
        }

        String rawType = detection.getType().trim().toLowerCase(Locale.ROOT);
        ViolationType type = ViolationType.fromWire(rawType);
        if (type == ViolationType.OTHER && !ViolationType.OTHER.getWireName().equals(rawType)) {
            logger.debug("Unknown violation type {} bucketed as other", rawType);
        }
        return Violation.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(detection.getSessionId())
                .ownerId(ownerId)
                .type(type)
                .rawType(rawType)
                .confidence(confidence)
                .detail(detection.getDetails())
                .detectedAt(Instant.ofEpochMilli(detection.getTimestamp()))
                .evidenceUrl(detection.getScreenshot())
                .metadata(detection.getMetadata() != null ? detection.getMetadata() : Map.of())
                .build();
    }

    public static Severity severity(ViolationType type, double confidence) {
        return Severity.max(type.getListedSeverity(), Severity.fromConfidence(confidence));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
