package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Known violation types with the severity bucket each type sits in regardless of confidence.
 * Names the detector does not know map to {@link #OTHER}, which is bucketed on confidence alone.
 */
public enum ViolationType {
    MULTIPLE_FACES("multiple_faces", Severity.CRITICAL,
            "Multiple faces detected. Please ensure you are alone during the exam."),
    IDENTITY_MISMATCH("identity_mismatch", Severity.CRITICAL,
            "Face verification failed. Please contact your instructor immediately."),
    COPY_PASTE("copy_paste", Severity.CRITICAL,
            "Copy-paste activity detected. This action is not allowed during the exam."),
    DEVELOPER_TOOLS("developer_tools", Severity.CRITICAL,
            "Developer tools detected. Please close all browser developer tools."),
    FACE_NOT_DETECTED("face_not_detected", Severity.HIGH,
            "Your face is not clearly visible. Please ensure your camera is working and you are facing the screen."),
    PHONE_DETECTED("phone_detected", Severity.HIGH,
            "Mobile device detected. Please remove all electronic devices from your workspace."),
    TAB_SWITCH("tab_switch", Severity.HIGH,
            "Browser tab switching detected. Please stay on the exam page."),
    SUSPICIOUS_AUDIO("suspicious_audio", Severity.HIGH,
            "Unusual audio activity detected. Please ensure you are not communicating with others."),
    GAZE_DEVIATION("gaze_deviation", Severity.MEDIUM,
            "You appear to be looking away from the screen. Please keep your eyes on the exam."),
    POOR_POSTURE("poor_posture", Severity.MEDIUM,
            "Unusual posture detected. Please sit normally and face the camera."),
    WINDOW_FOCUS_LOST("window_focus_lost", Severity.MEDIUM,
            "Exam window lost focus. Please return to the exam."),
    BOOK_DETECTED("book_detected", Severity.LOW,
            "Unauthorized materials detected. Please remove all books and papers from your workspace."),
    LAPTOP_DETECTED("laptop_detected", Severity.LOW,
            "Additional computer detected. Please ensure only one device is being used."),
    FULLSCREEN_VIOLATION("fullscreen_violation", Severity.LOW,
            "Please return to fullscreen mode to continue the exam."),
    COPY_PASTE_SHORTCUT("copy_paste_shortcut", Severity.LOW,
            "Copy/paste keyboard shortcut detected. This action is not allowed during the exam."),
    SUSPICIOUS_INTERACTION("suspicious_interaction", Severity.LOW,
            "Suspicious interaction with exam content detected."),
    OTHER("other", Severity.LOW,
            "Potential violation detected. Please follow exam guidelines.");

    private static final Map<String, ViolationType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(ViolationType::getWireName, Function.identity()));

    private final String wireName;
    private final Severity listedSeverity;
    private final String studentMessage;

    ViolationType(String wireName, Severity listedSeverity, String studentMessage) {
        this.wireName = wireName;
        this.listedSeverity = listedSeverity;
        this.studentMessage = studentMessage;
    }

    public static ViolationType fromWire(String name) {
        if (name == null) return OTHER;
        return BY_WIRE_NAME.getOrDefault(name.trim().toLowerCase(), OTHER);
    }

    @JsonValue
    public String getWireName() { return wireName; }
    public Severity getListedSeverity() { return listedSeverity; }
    public String getStudentMessage() { return studentMessage; }
}
