package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.config.AttendanceProperties.WindowConfig;
import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.enums.WindowMode;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the reporting window in force for write-triggered alerting.
 *
 * There is one global window policy: either a fixed historical range or a
 * trailing range of N days ending today. The policy is checked at startup.
 */
@Component
@Slf4j
public class ReportingWindowResolver {

    private final WindowConfig config;
    private final Clock clock;

    public ReportingWindowResolver(AttendanceProperties properties, Clock clock) {
        this.config = properties.getWindow();
        this.clock = clock;
        validate(config);
        log.info("Reporting window policy: {}", describe());
    }

    /**
     * The window to use right now.
     */
    public AttendanceWindow currentWindow() {
        if (config.getMode() == WindowMode.FIXED) {
            return AttendanceWindow.of(config.getStart(), config.getEnd());
        }
        return AttendanceWindow.trailing(LocalDate.now(clock), config.getTrailingDays());
    }

    public String describe() {
        if (config.getMode() == WindowMode.FIXED) {
            return "FIXED " + config.getStart() + " .. " + config.getEnd();
        }
        return "TRAILING " + config.getTrailingDays() + " day(s)";
    }

    private static void validate(WindowConfig config) {
        if (config.getMode() == null) {
            throw new IllegalStateException("heronix.attendance.window.mode must be FIXED or TRAILING");
        }
        if (config.getMode() == WindowMode.FIXED) {
            if (config.getStart() == null || config.getEnd() == null) {
                throw new IllegalStateException(
                        "heronix.attendance.window.start and .end are required in FIXED mode");
            }
            if (config.getEnd().isBefore(config.getStart())) {
                throw new IllegalStateException("heronix.attendance.window.end is before start");
            }
        } else if (config.getTrailingDays() < 1) {
            throw new IllegalStateException("heronix.attendance.window.trailing-days must be at least 1");
        }
    }
}
