package com.sportsdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the sports data pipeline service.
 */
@SpringBootApplication
public class SportsDataPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SportsDataPipelineApplication.class, args);
    }
}
