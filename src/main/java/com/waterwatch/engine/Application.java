package com.waterwatch.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the WaterWatch alarm engine.
 *
 * This Spring Boot application polls totalizer counters from the historian,
 * checks shift and day usage against threshold rules and sends SMS alarms to
 * the on-call contacts.
 *
 * Features:
 * - Live threshold status and alarm history at /api
 * - Prometheus metrics at /actuator/prometheus
 * - Health checks at /actuator/health
 * - Scheduled poll cycles with alarm de-duplication and cooldown
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class Application {

    public static void main(String[] args) {
        log.info("Starting WaterWatch alarm engine...");
        SpringApplication.run(Application.class, args);
        log.info("WaterWatch alarm engine started successfully!");
    }
}
