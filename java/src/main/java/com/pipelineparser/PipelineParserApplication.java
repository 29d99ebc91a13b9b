package com.pipelineparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Pipeline Parser Server Application
 *
 * Validates pipelines submitted by the visual pipeline editor, built with
 * Spring Boot WebFlux.
 */
@SpringBootApplication
public class PipelineParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineParserApplication.class, args);
    }

}
