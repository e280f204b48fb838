package com.flamingo.ai.docextract.service.extraction.ocr;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Base64;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends one image plus the text-extraction instruction to the vision-capable chat model.
 *
 * <p>Transient failures are retried and a failing endpoint trips the {@code vision} circuit
 * breaker; exceptions are propagated to {@link VisionOcrService}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisionModelClient {

  private static final String INSTRUCTION_TEMPLATE =
      "Extract all visible text from this image including labels, annotations, chart data, "
          + "diagram text, and any other readable content. If no text is visible, respond with "
          + "'%s'.";

  private final ChatModel visionChatModel;
  private final ExtractionConfig config;

  /**
   * Returns the raw model reply for the image.
   *
   * @param image encoded image bytes
   * @param mimeType MIME type of {@code image}
   * @return reply text, possibly the no-text sentinel or {@code null}
   */
  @CircuitBreaker(name = "vision")
  @Retry(name = "vision")
  public String readText(byte[] image, String mimeType) {
    String base64 = Base64.getEncoder().encodeToString(image);
    UserMessage message =
        UserMessage.from(
            TextContent.from(instruction(config.getOcr().getNoTextSentinel())),
            ImageContent.from(base64, mimeType, ImageContent.DetailLevel.HIGH));

    ChatRequest request =
        ChatRequest.builder()
            .messages(message)
            .temperature(config.getOcr().getTemperature())
            .maxOutputTokens(config.getOcr().getMaxOutputTokens())
            .build();

    ChatResponse response = visionChatModel.chat(request);
    if (response == null || response.aiMessage() == null) {
      return null;
    }
    log.debug("Vision model answered with {} characters",
        response.aiMessage().text() == null ? 0 : response.aiMessage().text().length());
    return response.aiMessage().text();
  }

  /** The extraction prompt, naming the reply {@link VisionOcrService} treats as "no text". */
  static String instruction(String noTextSentinel) {
    return String.format(Locale.ROOT, INSTRUCTION_TEMPLATE, noTextSentinel);
  }
}
