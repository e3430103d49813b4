package com.heronix.attendance.notifier.http;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.config.AttendanceProperties.NotifierConfig;
import com.heronix.attendance.exception.NotificationDeliveryException;
import com.heronix.attendance.notifier.AttendanceNotifier;

import lombok.extern.slf4j.Slf4j;
import reactor.util.retry.Retry;

/**
 * Delivers alerts to the institution's notification gateway over REST.
 *
 * The gateway owns templates, SMTP credentials and delivery; this client only posts
 * the alert payload. Transient failures (5xx, connection errors) are retried with
 * exponential backoff; a 4xx answer is reported as a failed delivery without retry.
 */
@Component
@ConditionalOnProperty(name = "heronix.attendance.notifier.enabled", havingValue = "true")
@Slf4j
public class HttpAttendanceNotifier implements AttendanceNotifier {

    static final String ALERTS_PATH = "/api/v1/notifications/attendance-alerts";

    private final WebClient webClient;
    private final NotifierConfig config;

    public HttpAttendanceNotifier(WebClient.Builder webClientBuilder, AttendanceProperties properties) {
        this.config = properties.getNotifier();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE);

        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("X-API-Key", apiKey);
        }

        this.webClient = builder.build();

        log.info("HTTP_NOTIFIER: Initialized - gateway URL: {}", config.getBaseUrl());
    }

    @Override
    public String getName() {
        return "http";
    }

    @Override
    public DeliveryResult send(AlertMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "LOW_ATTENDANCE");
        body.put("recipientEmail", message.contactEmail());
        body.put("studentName", message.studentName());
        body.put("courseName", message.courseName());
        body.put("percentage", round2(message.percentage()));
        body.put("thresholdPercent", message.thresholdPercent());

        try {
            webClient.post()
                    .uri(ALERTS_PATH)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .retryWhen(Retry.backoff(config.getRetryAttempts(), Duration.ofMillis(config.getRetryDelayMs()))
                            .filter(HttpAttendanceNotifier::isTransient)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block(Duration.ofSeconds(config.getTimeoutSeconds()));

            log.info("HTTP_NOTIFIER: Alert delivered to {} for {}", message.contactEmail(), message.courseName());
            return DeliveryResult.success("Delivered");

        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                log.warn("HTTP_NOTIFIER: Gateway rejected alert for {}: HTTP {}",
                        message.contactEmail(), e.getStatusCode().value());
                return DeliveryResult.failure("Rejected by gateway: HTTP " + e.getStatusCode().value());
            }
            throw new NotificationDeliveryException(
                    "Gateway error HTTP " + e.getStatusCode().value() + " for " + message.contactEmail(), e);
        } catch (WebClientRequestException e) {
            throw new NotificationDeliveryException("Gateway unreachable: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block() timeout
            throw new NotificationDeliveryException("Gateway timed out for " + message.contactEmail(), e);
        }
    }

    private static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError();
        }
        return error instanceof WebClientRequestException;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
