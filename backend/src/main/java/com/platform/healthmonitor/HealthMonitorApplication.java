package com.platform.healthmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Multi-project Docker health monitor.
 * 
 * Watches every running container that declares a healthcheck, confirms degraded
 * statuses with a delayed re-probe and alerts the owning project's recipients.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class HealthMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthMonitorApplication.class, args);
    }
}
