package com.scholary.refinery.config;

import com.scholary.refinery.generation.GenerationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the text-generation client.
 *
 * <p>Enables the GenerationProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {}
