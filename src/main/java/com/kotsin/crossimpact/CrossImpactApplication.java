package com.kotsin.crossimpact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


/**
 * Spring Boot Application for multi-level OFI and cross-impact analysis.
 */
@SpringBootApplication
public class CrossImpactApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrossImpactApplication.class, args);
    }
}
