package com.flamingo.ai.recall.config;

import com.flamingo.ai.recall.agent.ConflictClassificationAgent;
import com.flamingo.ai.recall.agent.MemoryExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the memory agents built with LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage, concrete implementations come
 * from AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Extracts candidate memories from one dialogue turn. */
  @Bean
  public MemoryExtractionAgent memoryExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(MemoryExtractionAgent.class).chatModel(chatModel).build();
  }

  /** Classifies contradictions for every category of a candidate in one request. */
  @Bean
  public ConflictClassificationAgent conflictClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(ConflictClassificationAgent.class).chatModel(chatModel).build();
  }
}
