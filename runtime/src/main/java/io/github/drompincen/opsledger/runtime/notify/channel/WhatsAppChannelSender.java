package io.github.drompincen.opsledger.runtime.notify.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

@Component
public class WhatsAppChannelSender extends RelayChannelSender {

    @Autowired
    public WhatsAppChannelSender(ObjectMapper objectMapper, LedgerProperties properties) {
        this(defaultClient(), objectMapper, properties);
    }

    WhatsAppChannelSender(HttpClient client, ObjectMapper objectMapper, LedgerProperties properties) {
        super(client, objectMapper, properties.getNotification().getWhatsapp());
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WHATSAPP;
    }
}
