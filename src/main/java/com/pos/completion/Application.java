package com.pos.completion;

import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the PosmCompletionService Micronaut application.
 *
 * This service reconciles field-survey submissions against the display
 * assignment catalog, computes POSM completion per store, model, region and
 * POSM type, and produces an audit report over the computed results.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting PosmCompletionService...");
        Micronaut.run(Application.class, args);
    }
}
