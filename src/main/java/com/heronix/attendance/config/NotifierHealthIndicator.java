package com.heronix.attendance.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.attendance.notifier.AttendanceNotifier;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for alert delivery.
 *
 * Reports which notifier is active. With no notifier configured the service stays UP
 * (attendance can still be recorded) but alerts are reported as undeliverable.
 */
@Component
@RequiredArgsConstructor
public class NotifierHealthIndicator implements HealthIndicator {

    private final AttendanceNotifier notifier;
    private final AttendanceProperties properties;

    @Override
    public Health health() {
        if (!properties.getNotifier().isEnabled()) {
            return Health.up()
                    .withDetail("notifier", notifier.getName())
                    .withDetail("alert-delivery", "disabled")
                    .build();
        }

        return Health.up()
                .withDetail("notifier", notifier.getName())
                .withDetail("alert-delivery", "enabled")
                .withDetail("gateway", properties.getNotifier().getBaseUrl())
                .build();
    }
}
