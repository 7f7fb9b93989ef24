package com.scholary.refinery.config;

import com.scholary.refinery.source.TranscriptSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the TranscriptSourceProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(TranscriptSourceProperties.class)
public class TranscriptSourceConfig {}
