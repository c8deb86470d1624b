package com.openforge.memgraph.nli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.llm.LanguageModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * NLI backend registry, keyed by memory.nli.backend.
 */
@Slf4j
@Configuration
public class NliConfig {

    @Bean
    @ConditionalOnProperty(name = "memory.nli.backend", havingValue = "http", matchIfMissing = true)
    public NliClassifier httpNliClassifier(HttpClient httpClient, ObjectMapper objectMapper, MemoryProperties props) {
        log.info("[NLI] Using NLI server at {}", props.nli().baseUrl());
        return new HttpNliClassifier(httpClient, objectMapper, props.nli());
    }

    @Bean
    @ConditionalOnProperty(name = "memory.nli.backend", havingValue = "llm")
    public NliClassifier llmNliClassifier(LanguageModel languageModel, ObjectMapper objectMapper) {
        log.info("[NLI] Using language-model NLI classifier");
        return new LlmNliClassifier(languageModel, objectMapper);
    }
}
