package com.warden.authservice;

import com.warden.authservice.config.WardenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Warden auth service: the HTTP edge in front of the security core.
 *
 * <p>Every request passes the edge filter, which resolves the route's sensitivity tier and
 * authorizes the caller before any controller runs. The controllers expose login for trusted
 * services, token refresh and introspection, session and API key self-service, and role
 * administration.
 */
@SpringBootApplication
@EnableConfigurationProperties(WardenProperties.class)
@EnableScheduling
public class WardenAuthApplication {

    private static final Logger log = LoggerFactory.getLogger(WardenAuthApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WardenAuthApplication.class, args);
        log.info("Warden auth service started successfully");
    }
}
