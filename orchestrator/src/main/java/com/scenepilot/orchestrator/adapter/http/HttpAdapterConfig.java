package com.scenepilot.orchestrator.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenepilot.orchestrator.adapter.GenerationAdapter;
import com.scenepilot.orchestrator.model.TaskKind;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares one {@link HttpGenerationAdapter} per provider that has a base URL
 * configured. Kinds without a provider get no adapter, and advancing into
 * their stage is rejected as a validation error.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class HttpAdapterConfig {

    @Bean
    @ConditionalOnProperty(prefix = "scenepilot.adapters.providers.image", name = "base-url")
    GenerationAdapter imageAdapter(ProviderProperties props, ObjectMapper objectMapper) {
        return new HttpGenerationAdapter(TaskKind.IMAGE, props.providers().get(TaskKind.IMAGE), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scenepilot.adapters.providers.voice", name = "base-url")
    GenerationAdapter voiceAdapter(ProviderProperties props, ObjectMapper objectMapper) {
        return new HttpGenerationAdapter(TaskKind.VOICE, props.providers().get(TaskKind.VOICE), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scenepilot.adapters.providers.video", name = "base-url")
    GenerationAdapter videoAdapter(ProviderProperties props, ObjectMapper objectMapper) {
        return new HttpGenerationAdapter(TaskKind.VIDEO, props.providers().get(TaskKind.VIDEO), objectMapper);
    }
}
