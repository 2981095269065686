package com.fleetmanager.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Fleet Analytics: driver and vehicle performance metrics from trip and fuel records
 */
@SpringBootApplication
public class FleetAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetAnalyticsApplication.class, args);
    }

}
