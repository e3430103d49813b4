package com.heronix.attendance.notifier;

/**
 * Outbound channel that delivers low-attendance alerts to students.
 *
 * Transport, formatting and retry on transient errors belong to the implementation.
 * Callers only see a binary outcome: a successful {@link DeliveryResult}, or a failed
 * result / {@link com.heronix.attendance.exception.NotificationDeliveryException}.
 */
public interface AttendanceNotifier {

    /**
     * Short name of the transport, reported in health details and logs.
     */
    String getName();

    /**
     * Deliver one alert.
     *
     * @param message alert content
     * @return delivery result
     */
    DeliveryResult send(AlertMessage message);

    // ========================================================================
    // MESSAGE & RESULT TYPES
    // ========================================================================

    /**
     * Content of a low-attendance alert.
     */
    record AlertMessage(
            String contactEmail,
            String studentName,
            String courseName,
            double percentage,
            double thresholdPercent
    ) {}

    /**
     * Result of a delivery attempt.
     */
    record DeliveryResult(
            boolean success,
            String message
    ) {
        public static DeliveryResult success(String message) {
            return new DeliveryResult(true, message);
        }

        public static DeliveryResult failure(String message) {
            return new DeliveryResult(false, message);
        }
    }
}
