package com.flamingo.ai.docextract.service.extraction.parsing;

import java.util.List;
import java.util.Map;

/**
 * Parser output in the single shape the rest of the pipeline depends on.
 *
 * @param text full document text; empty when the document has no text layer
 * @param pageCount page count reported by the library, or {@code null} if it reported none
 * @param info string-valued document information
 * @param metadata remaining non-string values reported by the library
 */
public record NormalizedParseResult(
    String text, Integer pageCount, Map<String, String> info, Map<String, Object> metadata) {

  public NormalizedParseResult {
    text = text == null ? "" : text;
    if (pageCount != null && pageCount <= 0) {
      pageCount = null;
    }
    info = info == null ? Map.of() : Map.copyOf(info);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static NormalizedParseResult empty() {
    return new NormalizedParseResult("", null, Map.of(), Map.of());
  }

  public boolean hasPageCount() {
    return pageCount != null;
  }

  public boolean hasText() {
    return !text.isBlank();
  }

  /** Whitespace-separated words of {@link #text()}, without empty tokens. */
  public List<String> words() {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+"));
  }
}
