package io.github.drompincen.opsledger.runtime.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentPlatformClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private LedgerProperties properties;
    private AgentPlatformClient client;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        client = new AgentPlatformClient(httpClient, new ObjectMapper(), properties);
    }

    @Test
    void invokePostsToActionEndpointAndDecodesBody() throws Exception {
        properties.getPlatform().setBaseUrl("https://platform.example/api/");
        properties.getPlatform().setApiKey("k-123");
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"summary\":\"3 new messages\",\"count\":3}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        Map<String, Object> result = client.invoke("agent-1", "check_messages", Map.of("jobId", "job-1"));

        assertThat(result).containsEntry("summary", "3 new messages").containsEntry("count", 3);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString())
                .isEqualTo("https://platform.example/api/agents/agent-1/actions/check_messages");
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer k-123");
        assertThat(request.getValue().timeout()).contains(Duration.ofMillis(30_000));
    }

    @Test
    void emptyBodyDecodesToEmptyMap() throws Exception {
        properties.getPlatform().setBaseUrl("https://platform.example");
        when(response.statusCode()).thenReturn(204);
        when(response.body()).thenReturn("");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThat(client.invoke("agent-1", "review_tasks", Map.of())).isEmpty();
    }

    @Test
    void errorStatusIsIOException() throws Exception {
        properties.getPlatform().setBaseUrl("https://platform.example");
        when(response.statusCode()).thenReturn(500);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.invoke("agent-1", "update_knowledge", Map.of()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void unconfiguredPlatformFailsFast() {
        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.invoke("agent-1", "check_messages", Map.of()))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(httpClient);
    }
}
