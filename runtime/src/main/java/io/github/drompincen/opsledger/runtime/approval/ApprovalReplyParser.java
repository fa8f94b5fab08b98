package io.github.drompincen.opsledger.runtime.approval;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a master contact's chat reply such as {@code approve}, {@code yes #3f2a} or
 * {@code reject 3f2a too expensive}.
 */
public final class ApprovalReplyParser {

    private static final Pattern APPROVE = Pattern.compile(
            "^(approve|yes|ok|confirm)(?:\\s+#?([a-f0-9-]+))?$");
    private static final Pattern REJECT = Pattern.compile(
            "^(reject|no|deny|decline)(?:\\s+#?([a-f0-9-]+))?(?:\\s+(.+))?$");

    public enum Decision { APPROVE, REJECT }

    /**
     * @param approvalRef id or id prefix of the approval, {@code null} for "the latest pending one"
     * @param reason      rejection reason, {@code null} when none was given
     */
    public record Reply(Decision decision, String approvalRef, String reason) {}

    private ApprovalReplyParser() {}

    public static Optional<Reply> parse(String message) {
        if (message == null) return Optional.empty();
        String text = message.strip().toLowerCase(Locale.ROOT);
        Matcher approve = APPROVE.matcher(text);
        if (approve.matches()) {
            return Optional.of(new Reply(Decision.APPROVE, approve.group(2), null));
        }
        Matcher reject = REJECT.matcher(text);
        if (reject.matches()) {
            String ref = reject.group(2);
            String reason = reject.group(3);
            return Optional.of(new Reply(Decision.REJECT, ref, reason != null ? originalCase(message, reason) : null));
        }
        return Optional.empty();
    }

    private static String originalCase(String original, String lowered) {
        String stripped = original.strip();
        int at = stripped.toLowerCase(Locale.ROOT).lastIndexOf(lowered);
        return at >= 0 ? stripped.substring(at, at + lowered.length()) : lowered;
    }
}
