package com.heronix.attendance.config;

import java.time.Duration;
import java.time.LocalDate;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.attendance.model.enums.WindowMode;

import lombok.Data;

/**
 * Configuration properties for Heronix Attendance.
 */
@Data
@ConfigurationProperties(prefix = "heronix.attendance")
public class AttendanceProperties {

    /**
     * Compliance alerting configuration
     */
    private AlertConfig alerts = new AlertConfig();

    /**
     * Reporting window used when alerts are triggered by attendance writes
     */
    private WindowConfig window = new WindowConfig();

    /**
     * Alert dispatch configuration
     */
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * Outbound notifier configuration
     */
    private NotifierConfig notifier = new NotifierConfig();

    @Data
    public static class AlertConfig {
        /**
         * Default compliance threshold in percent; a course may override it
         */
        private double thresholdPercent = 75.0;

        /**
         * Re-evaluate the course synchronously after every attendance write
         */
        private boolean evaluateOnWrite = true;

        /**
         * Worker threads for per-student evaluation (1 = sequential)
         */
        private int parallelThreads = 1;
    }

    @Data
    public static class WindowConfig {
        /**
         * FIXED uses start/end literally, TRAILING ends on the current date
         */
        private WindowMode mode = WindowMode.TRAILING;

        /**
         * Length of the trailing window in days, today included: 15 covers today and
         * the 14 days before it. The legacy portal started its window 15 days before
         * today (16 days in total); set 16 to reproduce that range.
         */
        private int trailingDays = 15;

        /**
         * First day of the fixed window (inclusive)
         */
        private LocalDate start;

        /**
         * Last day of the fixed window (inclusive)
         */
        private LocalDate end;
    }

    @Data
    public static class DispatchConfig {
        /**
         * Age after which a PENDING alert claim is considered abandoned and may be re-claimed
         */
        private Duration claimTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class NotifierConfig {
        /**
         * Enable the HTTP notifier; when false alerts cannot be delivered and are reported as failed
         */
        private boolean enabled = false;

        /**
         * Notification gateway base URL
         */
        private String baseUrl = "http://localhost:9590";

        /**
         * API key for service-to-service authentication.
         * In production, use environment variable: ATTENDANCE_NOTIFIER_API_KEY
         */
        private String apiKey;

        /**
         * Request timeout in seconds
         */
        private int timeoutSeconds = 10;

        /**
         * Retries for transient failures (5xx, connection errors)
         */
        private int retryAttempts = 3;

        /**
         * Initial delay between retries in milliseconds
         */
        private long retryDelayMs = 500;
    }
}
