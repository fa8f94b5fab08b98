package io.github.drompincen.opsledger.persistence.document;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class AgentProfileDocumentTest {

    @Test
    void approvalRequiredOnlyForListedKinds() {
        AgentProfileDocument doc = new AgentProfileDocument();
        doc.setApprovalRequiredActions(EnumSet.of(ActionKind.PROACTIVE_OUTREACH));

        assertThat(doc.requiresApproval(ActionKind.PROACTIVE_OUTREACH)).isTrue();
        assertThat(doc.requiresApproval(ActionKind.SEND_REPORT)).isFalse();
    }

    @Test
    void nullSetMeansNothingIsGated() {
        AgentProfileDocument doc = new AgentProfileDocument();
        doc.setApprovalRequiredActions(null);

        assertThat(doc.requiresApproval(ActionKind.CUSTOM_PROMPT)).isFalse();
        assertThat(doc.getEscalationTimeoutMinutes()).isEqualTo(60);
    }
}
