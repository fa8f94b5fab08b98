package io.github.drompincen.opsledger.runtime.notify.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.notify.ChannelMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API {@code sendMessage}. The bot token is part of the URL.
 */
@Component
public class TelegramChannelSender extends HttpChannelSender {

    private final LedgerProperties.Notification config;

    @Autowired
    public TelegramChannelSender(ObjectMapper objectMapper, LedgerProperties properties) {
        this(defaultClient(), objectMapper, properties);
    }

    TelegramChannelSender(HttpClient client, ObjectMapper objectMapper, LedgerProperties properties) {
        super(client, objectMapper);
        this.config = properties.getNotification();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.TELEGRAM;
    }

    @Override
    public boolean isConfigured() {
        return present(config.getTelegramBotToken());
    }

    @Override
    protected String url() {
        String base = config.getTelegramApiBase();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base + "/bot" + config.getTelegramBotToken() + "/sendMessage";
    }

    @Override
    protected String bearerToken() {
        return null;
    }

    @Override
    protected Map<String, Object> body(String address, ChannelMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", address);
        body.put("text", message.text());
        body.put("parse_mode", "Markdown");
        return body;
    }
}
