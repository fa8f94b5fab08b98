package io.github.drompincen.opsledger.gateway.config;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.convert.ConversionFailedException;
import org.springframework.format.support.DefaultFormattingConversionService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebConfigTest {

    private DefaultFormattingConversionService conversion;

    @BeforeEach
    void setUp() {
        conversion = new DefaultFormattingConversionService();
        new WebConfig().addFormatters(conversion);
    }

    @Test
    void queryParametersAcceptWireNames() {
        assertThat(conversion.convert("send_report", ActionKind.class)).isEqualTo(ActionKind.SEND_REPORT);
        assertThat(conversion.convert("success", JobStatus.class)).isEqualTo(JobStatus.SUCCESS);
        assertThat(conversion.convert("expired", ApprovalState.class)).isEqualTo(ApprovalState.EXPIRED);
        assertThat(conversion.convert("read", DeliveryStatus.class)).isEqualTo(DeliveryStatus.READ);
    }

    @Test
    void constantNamesStillWork() {
        assertThat(conversion.convert("FAILED", JobStatus.class)).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void unknownValueFailsConversion() {
        assertThatThrownBy(() -> conversion.convert("done", JobStatus.class))
                .isInstanceOf(ConversionFailedException.class)
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
    }
}
