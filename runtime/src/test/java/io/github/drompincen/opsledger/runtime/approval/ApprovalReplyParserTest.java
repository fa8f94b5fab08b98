package io.github.drompincen.opsledger.runtime.approval;

import io.github.drompincen.opsledger.runtime.approval.ApprovalReplyParser.Decision;
import io.github.drompincen.opsledger.runtime.approval.ApprovalReplyParser.Reply;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalReplyParserTest {

    @Test
    void bareApprovalWordsApproveLatest() {
        assertThat(ApprovalReplyParser.parse("approve")).contains(new Reply(Decision.APPROVE, null, null));
        assertThat(ApprovalReplyParser.parse("  YES ")).contains(new Reply(Decision.APPROVE, null, null));
        assertThat(ApprovalReplyParser.parse("ok")).isPresent();
    }

    @Test
    void approvalWithReference() {
        assertThat(ApprovalReplyParser.parse("approve #3f2a9c01"))
                .contains(new Reply(Decision.APPROVE, "3f2a9c01", null));
        assertThat(ApprovalReplyParser.parse("confirm 3F2A")).contains(new Reply(Decision.APPROVE, "3f2a", null));
    }

    @Test
    void rejectionKeepsReasonInOriginalCase() {
        assertThat(ApprovalReplyParser.parse("reject 3f2a Too Expensive today"))
                .contains(new Reply(Decision.REJECT, "3f2a", "Too Expensive today"));
        assertThat(ApprovalReplyParser.parse("no")).contains(new Reply(Decision.REJECT, null, null));
    }

    @Test
    void unrelatedMessagesAreNotReplies() {
        assertThat(ApprovalReplyParser.parse("what is the status?")).isEmpty();
        assertThat(ApprovalReplyParser.parse("approved yesterday")).isEmpty();
        assertThat(ApprovalReplyParser.parse(null)).isEmpty();
    }
}
