package io.facegate.domain.event;

import java.util.List;

/**
 * Dashboard statistics snapshot.
 * Built by the face-recognition back end and broadcast as-is.
 */
public record StatisticsUpdateEvent(
    String timestamp,
    long totalFaces,
    long activeFaces,
    long totalEvents,
    long eventsToday,
    double recognitionRate,
    double averageConfidence,
    SystemLoad systemLoad,
    List<CameraStatus> cameraStatus
) {
    public StatisticsUpdateEvent {
        cameraStatus = cameraStatus == null ? List.of() : List.copyOf(cameraStatus);
    }

    /**
     * Host load in percent.
     */
    public record SystemLoad(double cpu, double memory, double disk) {}

    public record CameraStatus(String cameraId, DeviceStatus status, String lastSeen) {}
}
