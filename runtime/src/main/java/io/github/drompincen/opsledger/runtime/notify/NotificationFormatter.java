package io.github.drompincen.opsledger.runtime.notify;

import io.github.drompincen.opsledger.persistence.document.NotificationDocument;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.protocol.api.Priority;

/**
 * Renders a notification as channel text. Email gets a subject and a plain body;
 * chat channels get a single Markdown-flavoured message.
 */
public final class NotificationFormatter {

    private NotificationFormatter() {}

    public static ChannelMessage format(NotificationDocument n, NotificationChannel channel, String subjectPrefix) {
        return channel == NotificationChannel.EMAIL ? email(n, subjectPrefix) : chat(n);
    }

    static ChannelMessage email(NotificationDocument n, String subjectPrefix) {
        String prefix = subjectPrefix == null || subjectPrefix.isBlank() ? "" : "[" + subjectPrefix + "] ";
        StringBuilder body = new StringBuilder();
        body.append(n.getType().label()).append(": ").append(n.getTitle()).append("\n\n");
        if (n.getMessage() != null) body.append(n.getMessage()).append("\n");
        if (n.isActionRequired()) body.append("\nACTION REQUIRED\n");
        return new ChannelMessage(prefix + marker(n.getPriority()) + n.getTitle(), body.toString());
    }

    static ChannelMessage chat(NotificationDocument n) {
        StringBuilder text = new StringBuilder();
        text.append(marker(n.getPriority())).append('*').append(n.getType().label()).append("*\n\n");
        text.append('*').append(n.getTitle()).append("*\n\n");
        if (n.getMessage() != null) text.append(n.getMessage());
        if (n.isActionRequired()) text.append("\n\n_Action required_");
        return new ChannelMessage(null, text.toString());
    }

    private static String marker(Priority priority) {
        if (priority == Priority.URGENT) return "URGENT: ";
        if (priority == Priority.HIGH) return "[!] ";
        return "";
    }
}
