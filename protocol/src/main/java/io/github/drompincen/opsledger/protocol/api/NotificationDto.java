package io.github.drompincen.opsledger.protocol.api;

import java.time.Instant;

public record NotificationDto(
        String notificationId,
        String agentId,
        String masterContactId,
        NotificationType type,
        String title,
        String message,
        Priority priority,
        NotificationChannel channel,
        DeliveryStatus status,
        int deliveryAttempts,
        String lastError,
        boolean actionRequired,
        ReferenceType referenceType,
        String referenceId,
        Instant createdAt,
        Instant sentAt,
        Instant deliveredAt,
        Instant readAt
) {}
