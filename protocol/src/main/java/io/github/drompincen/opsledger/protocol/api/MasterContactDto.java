package io.github.drompincen.opsledger.protocol.api;

import java.time.Instant;

public record MasterContactDto(
        String contactId,
        String agentId,
        String displayName,
        NotificationChannel preferredChannel,
        String email,
        String phone,
        String telegramChatId,
        Instant updatedAt
) {}
