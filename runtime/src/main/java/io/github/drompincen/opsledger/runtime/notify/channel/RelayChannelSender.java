package io.github.drompincen.opsledger.runtime.notify.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.notify.ChannelMessage;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Channel delivered through an HTTP relay ({@code {to, subject?, text}} with a bearer token).
 */
public abstract class RelayChannelSender extends HttpChannelSender {

    private final LedgerProperties.Endpoint endpoint;

    protected RelayChannelSender(HttpClient client, ObjectMapper objectMapper, LedgerProperties.Endpoint endpoint) {
        super(client, objectMapper);
        this.endpoint = endpoint;
    }

    @Override
    public boolean isConfigured() {
        return present(endpoint.getUrl());
    }

    @Override
    protected String url() {
        return endpoint.getUrl();
    }

    @Override
    protected String bearerToken() {
        return endpoint.getToken();
    }

    @Override
    protected Map<String, Object> body(String address, ChannelMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", channel().wire());
        body.put("to", address);
        if (message.subject() != null) body.put("subject", message.subject());
        body.put("text", message.text());
        return body;
    }
}
