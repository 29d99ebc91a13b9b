package com.pipelineparser.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-origin policy for browser clients of the pipeline editor.
 */
@Data
@ConfigurationProperties(prefix = "pipeline.cors")
public class CorsProperties {

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private List<String> allowedMethods = new ArrayList<>(List.of("*"));

    private List<String> allowedHeaders = new ArrayList<>(List.of("*"));
}
