package com.heronix.attendance.notifier;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Notifier used when no delivery channel is configured.
 *
 * Every alert is reported as failed so that no alert record is committed and the
 * alert is retried once a real notifier is enabled.
 */
@Component
@ConditionalOnProperty(name = "heronix.attendance.notifier.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class UnconfiguredNotifier implements AttendanceNotifier {

    @Override
    public String getName() {
        return "unconfigured";
    }

    @Override
    public DeliveryResult send(AlertMessage message) {
        log.warn("Notifier not configured; alert for {} in {} not delivered",
                message.contactEmail(), message.courseName());
        return DeliveryResult.failure("Notifier not configured");
    }
}
