package com.oddsfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the odds feed service.
 */
@SpringBootApplication
public class OddsFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(OddsFeedApplication.class, args);
    }
}
