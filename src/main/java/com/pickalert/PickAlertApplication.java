package com.pickalert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the draft pick alert service.
 */
@SpringBootApplication
public class PickAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(PickAlertApplication.class, args);
    }
}
