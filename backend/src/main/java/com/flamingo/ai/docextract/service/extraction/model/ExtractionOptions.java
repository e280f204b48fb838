package com.flamingo.ai.docextract.service.extraction.model;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import java.time.Duration;

/**
 * Per-call extraction settings.
 *
 * @param extractImageText send embedded images and scanned pages to the vision model
 * @param maxPages process at most this many pages; 0 processes all of them
 * @param batchSize pages processed concurrently
 * @param maxImagesPerPage embedded images OCR'd per page
 * @param timeout overall budget for the call
 */
public record ExtractionOptions(
    boolean extractImageText,
    int maxPages,
    int batchSize,
    int maxImagesPerPage,
    Duration timeout) {

  /** Page cap used when re-extracting a document whose stored chunks are missing. */
  public static final int FALLBACK_MAX_PAGES = 50;

  public ExtractionOptions {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1");
    }
    if (maxPages < 0) {
      throw new IllegalArgumentException("maxPages must not be negative");
    }
    if (maxImagesPerPage < 0) {
      throw new IllegalArgumentException("maxImagesPerPage must not be negative");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static ExtractionOptions from(ExtractionConfig config) {
    return new ExtractionOptions(
        config.getPipeline().isExtractImageText(),
        config.getPipeline().getMaxPages(),
        config.getPipeline().getBatchSize(),
        config.getOcr().getMaxImagesPerPage(),
        config.getPipeline().getTimeout());
  }

  /** Faster settings for on-demand re-extraction: no vision calls, first 50 pages. */
  public static ExtractionOptions fallback(ExtractionConfig config) {
    return from(config).withImageText(false).withMaxPages(FALLBACK_MAX_PAGES);
  }

  public ExtractionOptions withImageText(boolean enabled) {
    return new ExtractionOptions(enabled, maxPages, batchSize, maxImagesPerPage, timeout);
  }

  public ExtractionOptions withMaxPages(int pages) {
    return new ExtractionOptions(extractImageText, pages, batchSize, maxImagesPerPage, timeout);
  }

  public ExtractionOptions withBatchSize(int size) {
    return new ExtractionOptions(extractImageText, maxPages, size, maxImagesPerPage, timeout);
  }

  public ExtractionOptions withMaxImagesPerPage(int images) {
    return new ExtractionOptions(extractImageText, maxPages, batchSize, images, timeout);
  }

  public ExtractionOptions withTimeout(Duration budget) {
    return new ExtractionOptions(extractImageText, maxPages, batchSize, maxImagesPerPage, budget);
  }

  /** Number of pages to schedule for a document of {@code pageCount} pages. */
  public int pagesToProcess(int pageCount) {
    int pages = Math.max(1, pageCount);
    return maxPages > 0 ? Math.min(pages, maxPages) : pages;
  }
}
