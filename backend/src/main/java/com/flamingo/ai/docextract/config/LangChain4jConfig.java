package com.flamingo.ai.docextract.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j vision model used for OCR. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.vision-model.model-name:gpt-4o-mini}")
  private String visionModelName;

  @Value("${langchain4j.openai.vision-model.timeout-seconds:60}")
  private int timeoutSeconds;

  // Retries are applied by the "vision" resilience4j instance.
  @Value("${langchain4j.openai.vision-model.max-retries:0}")
  private int maxRetries;

  @Bean
  public ChatModel visionChatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(visionModelName)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(maxRetries)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
