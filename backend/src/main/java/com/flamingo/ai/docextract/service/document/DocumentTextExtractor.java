package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;

/**
 * Turns one family of document formats into text.
 *
 * <p>Implementations are Spring beans ordered with {@code @Order}; {@link
 * DocumentTextExtractorRouter} picks the first one that supports a MIME type. Adding a format means
 * adding a bean, nothing else.
 */
public interface DocumentTextExtractor {

  /**
   * Returns {@code true} if this extractor handles the given MIME type.
   *
   * @param mimeType lower-cased document MIME type
   * @return {@code true} if supported
   */
  boolean supports(String mimeType);

  /**
   * Extracts the document's text.
   *
   * @param buffer document bytes
   * @param options per-call settings; formats without pages or images may ignore them
   * @return extracted text; empty text is a valid result
   */
  ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options);
}
