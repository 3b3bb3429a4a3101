package com.whereq.orbit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Orbit.
 * A control plane that keeps declared workloads (processors, services and clusters)
 * running across cloud platforms: it admits them through named queues, places them
 * where accelerators are available and scales elastic ones with their load.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class OrbitApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrbitApplication.class, args);
    }
}
