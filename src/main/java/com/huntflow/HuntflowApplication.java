package com.huntflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the huntflow runtime.
 *
 * Huntflow is a threat-hunting language: scripts of statements that retrieve, filter,
 * correlate and transform typed cyber-observable entities from data sources.
 *
 * Key Features:
 * - ANTLR-based parser with expected-symbol error reporting
 * - Entity-centric patterns compiled to wire and in-store filters
 * - Relation-aware FIND over reference attributes
 * - Parser-driven code completion
 *
 * @author Huntflow Team
 * @version 1.0.0
 * @since 2026-10-18
 */
@SpringBootApplication
public class HuntflowApplication {

    /**
     * Main entry point; arguments are huntflow files to execute.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(HuntflowApplication.class, args);
    }
}
