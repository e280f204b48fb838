package com.flamingo.ai.docextract.service.chunking;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.TextChunk;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Splits text into chunks of at most {@code maxWords} whitespace-separated words.
 *
 * <p>Words are regrouped in order and joined with single spaces, so joining the chunks with a
 * space reproduces the input with its whitespace normalised.
 */
@Component
@RequiredArgsConstructor
public class WordChunker {

  private final ExtractionConfig config;

  /** Chunks with the configured word limit. */
  public List<TextChunk> chunk(String text) {
    return chunk(text, config.getChunking().getMaxWords());
  }

  /**
   * Chunks {@code text}.
   *
   * @param text input text, may be {@code null}
   * @param maxWords maximum words per chunk
   * @return chunks with ordinals starting at 0; empty for blank input
   * @throws IllegalArgumentException if {@code maxWords} is not positive
   */
  public List<TextChunk> chunk(String text, int maxWords) {
    if (maxWords <= 0) {
      throw new IllegalArgumentException("maxWords must be positive, got " + maxWords);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String[] words = text.trim().split("\\s+");
    List<TextChunk> chunks = new ArrayList<>((words.length + maxWords - 1) / maxWords);
    for (int start = 0; start < words.length; start += maxWords) {
      int end = Math.min(start + maxWords, words.length);
      String chunkText = String.join(" ", Arrays.asList(words).subList(start, end));
      chunks.add(new TextChunk(chunkText.trim(), chunks.size()));
    }
    return chunks;
  }
}
