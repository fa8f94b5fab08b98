package io.github.drompincen.opsledger.gateway.config;

import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.ApprovalState;
import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.JobStatus;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Query parameters use the same lowercase wire names as JSON bodies
 * ({@code ?status=success}, {@code ?actionType=send_report}).
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, JobStatus.class, JobStatus::from);
        registry.addConverter(String.class, ActionKind.class, ActionKind::from);
        registry.addConverter(String.class, ApprovalState.class, ApprovalState::from);
        registry.addConverter(String.class, NotificationType.class, NotificationType::from);
        registry.addConverter(String.class, DeliveryStatus.class, DeliveryStatus::from);
    }
}
