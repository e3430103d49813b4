package com.heronix.attendance.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.heronix.attendance.notifier.AttendanceNotifier.AlertMessage;
import com.heronix.attendance.notifier.AttendanceNotifier.DeliveryResult;
import com.heronix.attendance.notifier.UnconfiguredNotifier;

class NotifierHealthIndicatorTest {

    @Test
    void unconfiguredNotifierReportsDisabledDelivery() {
        UnconfiguredNotifier notifier = new UnconfiguredNotifier();
        Health health = new NotifierHealthIndicator(notifier, new AttendanceProperties()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("notifier", "unconfigured")
                .containsEntry("alert-delivery", "disabled");
    }

    @Test
    void unconfiguredNotifierNeverReportsSuccess() {
        DeliveryResult result = new UnconfiguredNotifier()
                .send(new AlertMessage("a@example.edu", "A", "Course", 10.0, 75.0));

        assertThat(result.success()).isFalse();
    }
}
