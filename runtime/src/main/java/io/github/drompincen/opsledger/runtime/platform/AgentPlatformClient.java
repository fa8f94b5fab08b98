package io.github.drompincen.opsledger.runtime.platform;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Calls the agent platform's HTTP API for actions that are not prompt driven
 * ({@code POST {base}/agents/{agentId}/actions/{action}}).
 */
@Component
public class AgentPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(AgentPlatformClient.class);

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final LedgerProperties properties;

    @Autowired
    public AgentPlatformClient(ObjectMapper objectMapper, LedgerProperties properties) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper, properties);
    }

    AgentPlatformClient(HttpClient client, ObjectMapper objectMapper, LedgerProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public boolean isConfigured() {
        String base = properties.getPlatform().getBaseUrl();
        return base != null && !base.isBlank();
    }

    /**
     * @return the decoded JSON response body (empty for an empty body)
     * @throws IOException          on transport errors and non-2xx responses
     * @throws InterruptedException when the job is cancelled mid-call
     */
    public Map<String, Object> invoke(String agentId, String action, Map<String, Object> body)
            throws IOException, InterruptedException {
        if (!isConfigured()) {
            throw new IllegalStateException("opsledger.platform.base-url is not configured");
        }
        LedgerProperties.Platform platform = properties.getPlatform();
        String base = platform.getBaseUrl().endsWith("/")
                ? platform.getBaseUrl().substring(0, platform.getBaseUrl().length() - 1) : platform.getBaseUrl();
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(base + "/agents/" + agentId + "/actions/" + action))
                .timeout(Duration.ofMillis(platform.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        if (platform.getApiKey() != null && !platform.getApiKey().isBlank()) {
            request.header("Authorization", "Bearer " + platform.getApiKey());
        }

        HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Platform returned HTTP " + response.statusCode() + " for " + action);
        }
        log.debug("Platform action {} for agent {} returned {}", action, agentId, response.statusCode());
        String text = response.body();
        if (text == null || text.isBlank()) return Map.of();
        return objectMapper.readValue(text, new TypeReference<Map<String, Object>>() {});
    }
}
