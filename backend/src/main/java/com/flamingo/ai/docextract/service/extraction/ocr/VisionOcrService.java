package com.flamingo.ai.docextract.service.extraction.ocr;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Image to text through the vision model.
 *
 * <p>Every failure mode collapses into "no text": an unreachable endpoint, an open circuit, a blank
 * reply or the configured no-text sentinel all yield {@link Optional#empty()}. Callers count the
 * attempt regardless of the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisionOcrService {

  private final VisionModelClient visionModelClient;
  private final ExtractionConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts the visible text of an image.
   *
   * @param image encoded image bytes
   * @param mimeType MIME type of {@code image}, e.g. {@code image/png}
   * @return the text, or empty if the image holds none or the call failed
   */
  public Optional<String> extractTextFromImage(byte[] image, String mimeType) {
    if (image == null || image.length == 0) {
      return Optional.empty();
    }
    meterRegistry.counter("extraction.vision.calls").increment();
    try {
      String reply = visionModelClient.readText(image, mimeType);
      if (reply == null || reply.isBlank()) {
        return Optional.empty();
      }
      String text = reply.trim();
      if (text.equals(config.getOcr().getNoTextSentinel())) {
        log.debug("Vision model reported no text in {} image", mimeType);
        return Optional.empty();
      }
      return Optional.of(text);
    } catch (RuntimeException e) {
      log.error("Vision OCR failed for {} image ({} bytes): {}",
          mimeType, image.length, e.getMessage());
      meterRegistry.counter("extraction.vision.failures").increment();
      return Optional.empty();
    }
  }
}
