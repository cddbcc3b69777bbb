package com.z254.vigil.warden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * WARDEN - Remediation decision and safety service.
 *
 * <p>WARDEN provides:
 * <ul>
 *   <li>Event validation and fingerprinting of reliability telemetry</li>
 *   <li>Anomaly classification against static thresholds and learned baselines</li>
 *   <li>Incident-outcome memory with similarity recall</li>
 *   <li>Healing policies with cooldowns and hourly rate limits</li>
 *   <li>A safety gateway enforcing advisory, approval and autonomous execution</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class WardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(WardenApplication.class, args);
    }
}
