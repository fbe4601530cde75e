package io.facegate.service.core;

import io.facegate.auth.Identity;
import io.facegate.domain.common.EventType;
import io.facegate.domain.event.ActivityLogEvent;
import io.facegate.domain.event.AlertEvent;
import io.facegate.domain.event.AlertSeverity;
import io.facegate.domain.event.AlertType;
import io.facegate.domain.event.DeviceStatus;
import io.facegate.domain.event.DeviceStatusEvent;
import io.facegate.domain.event.DeviceType;
import io.facegate.domain.event.FaceEventKind;
import io.facegate.domain.event.FaceRecognitionEvent;
import io.facegate.domain.event.NotificationEvent;
import io.facegate.domain.event.NotificationKind;
import io.facegate.domain.event.Severity;
import io.facegate.domain.event.StatisticsUpdateEvent;
import io.facegate.domain.event.SystemEvent;
import io.facegate.domain.event.SystemEventKind;
import io.facegate.domain.event.UserSummary;
import io.facegate.domain.event.UserUpdateEvent;
import io.facegate.domain.event.UserUpdateKind;
import io.facegate.gateway.BroadcastTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer API used by back-end services to push realtime events.
 * Builds the typed payload, stamps id and timestamp, and publishes it on the event bus.
 */
public final class EventSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(EventSourceAdapter.class);

    private final EventBus bus;
    private final UserDirectory users;
    private final Clock clock;
    private final AtomicLong seq = new AtomicLong(0);

    public EventSourceAdapter(EventBus bus, UserDirectory users) {
        this(bus, users, Clock.systemUTC());
    }

    public EventSourceAdapter(EventBus bus, UserDirectory users, Clock clock) {
        this.bus = bus;
        this.users = users;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // FACE RECOGNITION
    // ═══════════════════════════════════════════════════════════════

    public FaceRecognitionEvent emitFaceRecognitionEvent(FaceEventKind kind, String faceId, String userId,
                                                         double confidence, String cameraId,
                                                         String location, String imageUrl,
                                                         Map<String, Object> metadata) {
        FaceRecognitionEvent event = new FaceRecognitionEvent(
            nextEventId(), kind, faceId, userId, confidence, cameraId, location, imageUrl,
            metadata, now(), clock.millis()
        );
        publish(EventType.FACE_RECOGNITION, event);
        log.info("Face recognition event emitted: {} face={}", kind, faceId);
        return event;
    }

    public FaceRecognitionEvent emitFaceRecognized(String faceId, double confidence, String userId,
                                                   String cameraId, Map<String, Object> metadata) {
        return emitFaceRecognitionEvent(FaceEventKind.RECOGNITION_EVENT, faceId, userId, confidence,
            cameraId, null, null, metadata);
    }

    public FaceRecognitionEvent emitUnknownFaceDetected(String faceId, double confidence, String cameraId,
                                                        Map<String, Object> metadata) {
        return emitFaceRecognitionEvent(FaceEventKind.UNKNOWN_FACE, faceId, null, confidence,
            cameraId, null, null, metadata);
    }

    public FaceRecognitionEvent emitFaceEnrolled(String faceId, String userId, double confidence,
                                                 Map<String, Object> metadata) {
        return emitFaceRecognitionEvent(FaceEventKind.ENROLLMENT_EVENT, faceId, userId, confidence,
            null, null, null, metadata);
    }

    public FaceRecognitionEvent emitFaceVerification(String faceId, String userId, double confidence,
                                                     boolean success, Map<String, Object> metadata) {
        Map<String, Object> withOutcome = new LinkedHashMap<>();
        if (metadata != null) {
            withOutcome.putAll(metadata);
        }
        withOutcome.put("success", success);
        return emitFaceRecognitionEvent(FaceEventKind.VERIFICATION_EVENT, faceId, userId, confidence,
            null, null, null, withOutcome);
    }

    // ═══════════════════════════════════════════════════════════════
    // USERS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Resolve the user and emit. Unknown users are logged and nothing is emitted.
     */
    public Optional<UserUpdateEvent> emitUserUpdate(String userId, UserUpdateKind kind) {
        Optional<UserSummary> user;
        try {
            user = users.findById(userId);
        } catch (RuntimeException e) {
            log.error("User lookup failed for {}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        }
        if (user.isEmpty()) {
            log.warn("User update {} skipped: unknown user {}", kind, userId);
            return Optional.empty();
        }
        return Optional.of(emitUserUpdate(user.get(), kind));
    }

    public UserUpdateEvent emitUserUpdate(UserSummary user, UserUpdateKind kind) {
        UserUpdateEvent event = new UserUpdateEvent(user.id(), kind, user, now());
        publish(EventType.USER_UPDATE, event);
        log.info("User update emitted: {} for user {}", kind, user.id());
        return event;
    }

    public Optional<UserUpdateEvent> emitUserCreated(String userId) {
        return emitUserUpdate(userId, UserUpdateKind.CREATED);
    }

    public Optional<UserUpdateEvent> emitUserUpdated(String userId) {
        return emitUserUpdate(userId, UserUpdateKind.UPDATED);
    }

    public Optional<UserUpdateEvent> emitUserDeleted(String userId) {
        return emitUserUpdate(userId, UserUpdateKind.DELETED);
    }

    public Optional<UserUpdateEvent> emitUserActivated(String userId) {
        return emitUserUpdate(userId, UserUpdateKind.ACTIVATED);
    }

    public Optional<UserUpdateEvent> emitUserDeactivated(String userId) {
        return emitUserUpdate(userId, UserUpdateKind.DEACTIVATED);
    }

    /**
     * Announce that a user connected to or left the gateway: an UPDATED user
     * event whose {@code online} flag tells the two apart.
     */
    public UserUpdateEvent emitUserPresence(Identity identity, boolean connected) {
        UserSummary summary = new UserSummary(identity.subject(), identity.email(), null, null,
            identity.role(), true, null);
        UserUpdateEvent event = new UserUpdateEvent(identity.subject(), UserUpdateKind.UPDATED, summary, now(), connected);
        publish(EventType.USER_UPDATE, event);
        log.debug("Presence emitted: user={} connected={}", identity.subject(), connected);
        return event;
    }

    // ═══════════════════════════════════════════════════════════════
    // SYSTEM
    // ═══════════════════════════════════════════════════════════════

    public SystemEvent emitSystemEvent(SystemEventKind kind, String message, Severity severity,
                                       Map<String, Object> metadata) {
        SystemEvent event = new SystemEvent(nextEventId(), kind,
            severity == null ? Severity.INFO : severity, message, now(), metadata);
        publish(EventType.SYSTEM_EVENT, event);
        log.info("System event emitted: {} - {}", kind, message);
        return event;
    }

    public SystemEvent emitSystemStart() {
        return emitSystemEvent(SystemEventKind.SYSTEM_START, "System started successfully", Severity.INFO, null);
    }

    public SystemEvent emitSystemStop() {
        return emitSystemEvent(SystemEventKind.SYSTEM_STOP, "System stopping", Severity.INFO, null);
    }

    public SystemEvent emitConfigUpdate(String configName) {
        return emitSystemEvent(SystemEventKind.CONFIG_UPDATE, "Configuration updated: " + configName,
            Severity.INFO, null);
    }

    public SystemEvent emitBackupComplete() {
        return emitSystemEvent(SystemEventKind.BACKUP_COMPLETE, "Database backup completed successfully",
            Severity.INFO, null);
    }

    public SystemEvent emitSystemError(Throwable error, Map<String, Object> context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("stack", stackTrace(error));
        if (context != null) {
            metadata.putAll(context);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return emitSystemEvent(SystemEventKind.ERROR_OCCURRED, message, Severity.ERROR, metadata);
    }

    // ═══════════════════════════════════════════════════════════════
    // STATISTICS / ACTIVITY
    // ═══════════════════════════════════════════════════════════════

    public StatisticsUpdateEvent emitStatisticsUpdate(StatisticsUpdateEvent statistics) {
        publish(EventType.STATISTICS_UPDATE, statistics);
        log.debug("Statistics update emitted");
        return statistics;
    }

    public ActivityLogEvent emitActivityLog(String userId, String action, String resource,
                                            Map<String, Object> details, String ipAddress, String userAgent) {
        ActivityLogEvent event = new ActivityLogEvent(nextEventId(), userId, action, resource, details,
            now(), ipAddress, userAgent);
        publish(EventType.ACTIVITY_LOG, event);
        log.info("Activity log emitted: {} on {} by user {}", action, resource, userId);
        return event;
    }

    // ═══════════════════════════════════════════════════════════════
    // ALERTS
    // ═══════════════════════════════════════════════════════════════

    public AlertEvent emitAlert(AlertType type, AlertSeverity severity, String title, String message,
                                Map<String, Object> metadata) {
        AlertEvent event = new AlertEvent(nextEventId(), type, severity, title, message, now(), false, metadata);
        publish(EventType.ALERT, event);
        log.info("Alert emitted: {} - {}", title, message);
        return event;
    }

    public AlertEvent emitSecurityAlert(String message, Map<String, Object> metadata) {
        return emitAlert(AlertType.SECURITY, AlertSeverity.HIGH, "Security Alert", message, metadata);
    }

    public AlertEvent emitSystemAlert(String message, Map<String, Object> metadata) {
        return emitAlert(AlertType.SYSTEM, AlertSeverity.MEDIUM, "System Alert", message, metadata);
    }

    public AlertEvent emitPerformanceAlert(String message, Map<String, Object> metadata) {
        return emitAlert(AlertType.PERFORMANCE, AlertSeverity.MEDIUM, "Performance Alert", message, metadata);
    }

    // ═══════════════════════════════════════════════════════════════
    // DEVICES
    // ═══════════════════════════════════════════════════════════════

    public DeviceStatusEvent emitDeviceStatus(String deviceId, DeviceType deviceType, DeviceStatus status,
                                              Map<String, Object> metrics, List<String> alerts) {
        DeviceStatusEvent event = new DeviceStatusEvent(deviceId, deviceType, status, now(), metrics, alerts);
        publish(EventType.DEVICE_STATUS, event);
        log.info("Device status emitted: {} - {}", deviceId, status);
        return event;
    }

    public DeviceStatusEvent emitCameraOnline(String cameraId) {
        return emitDeviceStatus(cameraId, DeviceType.CAMERA, DeviceStatus.ONLINE, null, null);
    }

    public DeviceStatusEvent emitCameraOffline(String cameraId) {
        return emitDeviceStatus(cameraId, DeviceType.CAMERA, DeviceStatus.OFFLINE, null, null);
    }

    public DeviceStatusEvent emitCameraError(String cameraId, String error) {
        return emitDeviceStatus(cameraId, DeviceType.CAMERA, DeviceStatus.ERROR, null, List.of(error));
    }

    // ═══════════════════════════════════════════════════════════════
    // NOTIFICATIONS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Send to the listed users, or to everyone when {@code targetUsers} is null or empty.
     */
    public NotificationEvent emitNotification(NotificationKind kind, String title, String message,
                                              List<String> targetUsers) {
        boolean global = targetUsers == null || targetUsers.isEmpty();
        NotificationEvent event = new NotificationEvent(nextEventId(), kind, title, message, now(),
            global ? null : targetUsers, global, null);
        BroadcastTarget target = global ? BroadcastTarget.all() : BroadcastTarget.users(Set.copyOf(targetUsers));
        bus.publish(new DomainEvent(EventType.NOTIFICATION, event, target));
        log.info("Notification emitted: {} (global={})", title, global);
        return event;
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private void publish(EventType type, Object payload) {
        bus.publish(DomainEvent.toAll(type, payload));
    }

    private String nextEventId() {
        return "event_" + clock.millis() + "_" + seq.incrementAndGet();
    }

    private String now() {
        return clock.instant().toString();
    }

    private static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
