package com.civica;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Civica - batched, cached and circuit-protected
 * AI analysis gateway for the voter simulation.
 */
@SpringBootApplication
public class CivicaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CivicaApplication.class, args);
    }
}
