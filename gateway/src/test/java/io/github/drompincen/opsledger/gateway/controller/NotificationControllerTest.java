package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.persistence.document.AgentProfileDocument;
import io.github.drompincen.opsledger.persistence.document.NotificationDocument;
import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.NotificationDto;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.notify.NotificationDispatcher;
import io.github.drompincen.opsledger.runtime.profile.ProfileService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationControllerTest {

    @Mock private NotificationDispatcher dispatcher;
    @Mock private ProfileService profileService;

    private NotificationController controller;

    @BeforeEach
    void setUp() {
        controller = new NotificationController(dispatcher, profileService);
    }

    private NotificationDocument notification(DeliveryStatus status) {
        NotificationDocument n = new NotificationDocument();
        n.setNotificationId("n1");
        n.setAgentId("agent-1");
        n.setType(NotificationType.BUDGET_WARNING);
        n.setTitle("Budget Warning");
        n.setStatus(status);
        n.setCreatedAt(Instant.parse("2026-03-02T09:00:00Z"));
        return n;
    }

    @Test
    void listPassesFilters() {
        when(dispatcher.list("agent-1", NotificationType.BUDGET_WARNING, DeliveryStatus.SENT, 10))
                .thenReturn(List.of(notification(DeliveryStatus.SENT)));

        List<NotificationDto> result =
                controller.list("agent-1", NotificationType.BUDGET_WARNING, DeliveryStatus.SENT, 10);

        assertThat(result).extracting(NotificationDto::type).containsExactly(NotificationType.BUDGET_WARNING);
    }

    @Test
    void markReadReturnsReadRow() {
        NotificationDocument read = notification(DeliveryStatus.READ);
        read.setReadAt(Instant.parse("2026-03-02T09:05:00Z"));
        when(dispatcher.markRead("agent-1", "n1")).thenReturn(read);

        ResponseEntity<NotificationDto> response = controller.markRead("agent-1", "n1");

        assertThat(response.getBody().status()).isEqualTo(DeliveryStatus.READ);
        assertThat(response.getBody().readAt()).isEqualTo(Instant.parse("2026-03-02T09:05:00Z"));
    }

    @Test
    void resendOfSentRowPropagatesInvalidState() {
        when(dispatcher.resend("agent-1", "n1")).thenThrow(new InvalidStateException("Only failed notifications can be resent"));

        assertThatThrownBy(() -> controller.resend("agent-1", "n1")).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void testNotificationIsAccepted() {
        when(profileService.get("agent-1")).thenReturn(new AgentProfileDocument());
        NotificationDocument queued = notification(DeliveryStatus.PENDING);
        queued.setType(NotificationType.TEST);
        when(dispatcher.sendTest("agent-1", "ping")).thenReturn(queued);

        ResponseEntity<NotificationDto> response = controller.sendTest("agent-1", Map.of("message", "ping"));

        assertThat(response.getStatusCode().value()).isEqualTo(202);
        assertThat(response.getBody().type()).isEqualTo(NotificationType.TEST);
    }

    @Test
    void testNotificationForUnknownAgentIsNotFound() {
        when(profileService.get("ghost")).thenThrow(NotFoundException.of("Agent profile", "ghost"));

        assertThatThrownBy(() -> controller.sendTest("ghost", null)).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(dispatcher);
    }
}
