package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.NotificationDocument;
import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.NotificationDto;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import io.github.drompincen.opsledger.runtime.notify.NotificationDispatcher;
import io.github.drompincen.opsledger.runtime.profile.ProfileService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/agentic/profiles/{agentId}/notifications")
public class NotificationController {

    private final NotificationDispatcher dispatcher;
    private final ProfileService profileService;

    public NotificationController(NotificationDispatcher dispatcher, ProfileService profileService) {
        this.dispatcher = dispatcher;
        this.profileService = profileService;
    }

    @GetMapping
    public List<NotificationDto> list(@PathVariable String agentId,
                                      @RequestParam(required = false) NotificationType type,
                                      @RequestParam(required = false) DeliveryStatus status,
                                      @RequestParam(defaultValue = "50") int limit) {
        return dispatcher.list(agentId, type, status, limit).stream().map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{notificationId}")
    public ResponseEntity<NotificationDto> get(@PathVariable String agentId, @PathVariable String notificationId) {
        return ResponseEntity.ok(toDto(dispatcher.get(agentId, notificationId)));
    }

    @PutMapping("/{notificationId}/read")
    public ResponseEntity<NotificationDto> markRead(@PathVariable String agentId,
                                                    @PathVariable String notificationId) {
        return ResponseEntity.ok(toDto(dispatcher.markRead(agentId, notificationId)));
    }

    @PutMapping("/{notificationId}/delivered")
    public ResponseEntity<NotificationDto> markDelivered(@PathVariable String agentId,
                                                         @PathVariable String notificationId) {
        return ResponseEntity.ok(toDto(dispatcher.markDelivered(agentId, notificationId)));
    }

    @PostMapping("/{notificationId}/resend")
    public ResponseEntity<NotificationDto> resend(@PathVariable String agentId,
                                                  @PathVariable String notificationId) {
        return ResponseEntity.accepted().body(toDto(dispatcher.resend(agentId, notificationId)));
    }

    @PostMapping("/test")
    public ResponseEntity<NotificationDto> sendTest(@PathVariable String agentId,
                                                    @RequestBody(required = false) Map<String, String> body) {
        profileService.get(agentId);
        String message = body != null ? body.get("message") : null;
        return ResponseEntity.accepted().body(toDto(dispatcher.sendTest(agentId, message)));
    }

    // --- DTO Mappers ---

    private NotificationDto toDto(NotificationDocument doc) {
        return new NotificationDto(
                doc.getNotificationId(),
                doc.getAgentId(),
                doc.getMasterContactId(),
                doc.getType(),
                doc.getTitle(),
                doc.getMessage(),
                doc.getPriority(),
                doc.getChannel(),
                doc.getStatus(),
                doc.getDeliveryAttempts(),
                doc.getLastError(),
                doc.isActionRequired(),
                doc.getReferenceType(),
                doc.getReferenceId(),
                doc.getCreatedAt(),
                doc.getSentAt(),
                doc.getDeliveredAt(),
                doc.getReadAt()
        );
    }
}
