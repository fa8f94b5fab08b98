package io.github.drompincen.opsledger.runtime.notify;

import io.github.drompincen.opsledger.persistence.document.NotificationDocument;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import io.github.drompincen.opsledger.protocol.api.Priority;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationFormatterTest {

    private static NotificationDocument notification(NotificationType type, Priority priority) {
        NotificationDocument n = new NotificationDocument();
        n.setType(type);
        n.setTitle("Approve send_report");
        n.setMessage("Reply \"approve 1234abcd\"");
        n.setPriority(priority);
        n.setActionRequired(type.actionRequired());
        return n;
    }

    @Test
    void emailHasPrefixedSubjectAndPlainBody() {
        ChannelMessage message = NotificationFormatter.format(
                notification(NotificationType.APPROVAL_NEEDED, Priority.URGENT), NotificationChannel.EMAIL, "Ops Ledger");

        assertThat(message.subject()).isEqualTo("[Ops Ledger] URGENT: Approve send_report");
        assertThat(message.text())
                .startsWith("Approval Required: Approve send_report\n\n")
                .contains("Reply \"approve 1234abcd\"")
                .contains("ACTION REQUIRED");
    }

    @Test
    void blankPrefixIsOmitted() {
        ChannelMessage message = NotificationFormatter.format(
                notification(NotificationType.TASK_COMPLETED, Priority.NORMAL), NotificationChannel.EMAIL, " ");

        assertThat(message.subject()).isEqualTo("Approve send_report");
        assertThat(message.text()).doesNotContain("ACTION REQUIRED");
    }

    @Test
    void chatChannelsGetMarkdownWithoutSubject() {
        for (NotificationChannel channel : new NotificationChannel[]{
                NotificationChannel.TELEGRAM, NotificationChannel.WHATSAPP, NotificationChannel.SMS}) {
            ChannelMessage message = NotificationFormatter.format(
                    notification(NotificationType.BUDGET_WARNING, Priority.HIGH), channel, "Ops Ledger");

            assertThat(message.subject()).as(channel.wire()).isNull();
            assertThat(message.text()).startsWith("[!] *Budget Warning*\n\n*Approve send_report*\n\n")
                    .doesNotContain("_Action required_");
        }
    }
}
