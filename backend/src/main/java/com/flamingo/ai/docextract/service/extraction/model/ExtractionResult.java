package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;

/**
 * Output of one extraction call.
 *
 * @param combinedText page-ordered text with page and image markers; may be empty
 * @param visionCallCount vision-model calls made during the run
 * @param pagesProcessed pages that produced a result (failed pages count, unfinished ones do not)
 * @param totalPages pages scheduled for processing
 * @param pages per-page breakdown in ascending page order
 * @param timedOut whether the call budget expired before every page finished
 */
public record ExtractionResult(
    String combinedText,
    int visionCallCount,
    int pagesProcessed,
    int totalPages,
    List<PageResult> pages,
    boolean timedOut) {

  public ExtractionResult {
    combinedText = combinedText == null ? "" : combinedText;
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  /** Result for non-paged formats, where the whole text counts as one page. */
  public static ExtractionResult ofText(String text) {
    String value = text == null ? "" : text;
    return new ExtractionResult(value, 0, 1, 1, List.of(PageResult.textOnly(1, value)), false);
  }

  public boolean isEmpty() {
    return combinedText.isBlank();
  }
}
