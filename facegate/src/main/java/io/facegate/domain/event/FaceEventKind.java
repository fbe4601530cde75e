package io.facegate.domain.event;

/**
 * What a face recognition event reports.
 */
public enum FaceEventKind {
    RECOGNITION_EVENT,
    ENROLLMENT_EVENT,
    UNKNOWN_FACE,
    VERIFICATION_EVENT
}
