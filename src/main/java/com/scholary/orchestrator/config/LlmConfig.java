package com.scholary.orchestrator.config;

import com.scholary.orchestrator.llm.LlmProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LLM prompt pipeline.
 *
 * <p>Enables the LlmProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfig {}
