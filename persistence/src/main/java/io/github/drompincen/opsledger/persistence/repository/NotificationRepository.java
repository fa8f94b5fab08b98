package io.github.drompincen.opsledger.persistence.repository;

import io.github.drompincen.opsledger.persistence.document.NotificationDocument;
import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface NotificationRepository extends MongoRepository<NotificationDocument, String> {
    List<NotificationDocument> findByAgentIdOrderByCreatedAtDesc(String agentId, Pageable pageable);
    List<NotificationDocument> findByAgentIdAndTypeOrderByCreatedAtDesc(String agentId, NotificationType type, Pageable pageable);
    List<NotificationDocument> findByAgentIdAndStatusOrderByCreatedAtDesc(String agentId, DeliveryStatus status, Pageable pageable);
    List<NotificationDocument> findByAgentIdAndTypeAndStatusOrderByCreatedAtDesc(String agentId, NotificationType type,
                                                                                 DeliveryStatus status, Pageable pageable);
    Optional<NotificationDocument> findByNotificationIdAndAgentId(String notificationId, String agentId);
    List<NotificationDocument> findByStatusAndNextAttemptAtLessThanEqual(DeliveryStatus status, Instant now);
}
