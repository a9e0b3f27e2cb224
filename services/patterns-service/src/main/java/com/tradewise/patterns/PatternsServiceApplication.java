package com.tradewise.patterns;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Patterns Service Application
 *
 * Serves demo and self-test endpoints for sixteen design patterns applied to
 * an in-memory order and payment domain.
 */
@SpringBootApplication
@ComponentScan(basePackages = {"com.tradewise.patterns", "com.tradewise.common"})
public class PatternsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternsServiceApplication.class, args);
    }
}
