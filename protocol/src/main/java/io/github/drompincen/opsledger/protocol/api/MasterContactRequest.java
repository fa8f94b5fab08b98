package io.github.drompincen.opsledger.protocol.api;

public record MasterContactRequest(
        String displayName,
        NotificationChannel preferredChannel,
        String email,
        String phone,
        String telegramChatId
) {}
