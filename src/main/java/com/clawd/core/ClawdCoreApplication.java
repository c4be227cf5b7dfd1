package com.clawd.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Clawd Core - rate-limited caching, retries and AI provider failover
 * shared by the Clawd workers and bot gateway.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ClawdCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawdCoreApplication.class, args);
    }
}
