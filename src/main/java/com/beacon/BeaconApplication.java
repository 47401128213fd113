package com.beacon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Beacon query service.
 * 
 * Beacon answers time-range queries for dashboards and alerts against
 * ClickHouse and Prometheus, serving repeated windows from a series cache
 * and fetching only the part of the window that is not cached yet.
 */
@SpringBootApplication
public class BeaconApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeaconApplication.class, args);
    }
}
