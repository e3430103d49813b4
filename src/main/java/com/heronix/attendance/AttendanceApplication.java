package com.heronix.attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.attendance.config.AttendanceProperties;

/**
 * Heronix Attendance - Attendance Ledger and Compliance Alerting Engine
 *
 * Records one attendance fact per student, course and day, and after every write
 * re-evaluates the course against its compliance threshold. Students who fall below
 * the threshold in the reporting window are alerted exactly once per window.
 */
@SpringBootApplication
@EnableConfigurationProperties(AttendanceProperties.class)
public class AttendanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttendanceApplication.class, args);
    }
}
