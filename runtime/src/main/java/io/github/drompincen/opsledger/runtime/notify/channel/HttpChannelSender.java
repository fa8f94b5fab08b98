package io.github.drompincen.opsledger.runtime.notify.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.runtime.error.DeliveryFailureException;
import io.github.drompincen.opsledger.runtime.notify.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Base for channels reached by POSTing JSON over HTTP.
 */
public abstract class HttpChannelSender implements ChannelSender {

    private static final Logger log = LoggerFactory.getLogger(HttpChannelSender.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    protected final ObjectMapper objectMapper;

    protected HttpChannelSender(HttpClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    protected static HttpClient defaultClient() {
        return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }

    @Override
    public void send(String address, ChannelMessage message) {
        if (!isConfigured()) {
            throw new DeliveryFailureException(channel().wire() + " channel is not configured");
        }
        if (address == null || address.isBlank()) {
            throw new DeliveryFailureException("Master contact has no " + channel().wire() + " address");
        }
        post(url(), bearerToken(), body(address, message));
    }

    protected abstract String url();

    /** Token for the {@code Authorization: Bearer} header, or null for none. */
    protected abstract String bearerToken();

    protected abstract Map<String, Object> body(String address, ChannelMessage message);

    private void post(String url, String token, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DeliveryFailureException("Cannot encode " + channel().wire() + " payload", e);
        }
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }
        try {
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new DeliveryFailureException(channel().wire() + " returned HTTP " + response.statusCode()
                        + ": " + abbreviate(response.body()));
            }
            log.debug("{} accepted message ({})", channel().wire(), response.statusCode());
        } catch (IOException e) {
            throw new DeliveryFailureException(channel().wire() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryFailureException(channel().wire() + " request interrupted", e);
        }
    }

    protected static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
