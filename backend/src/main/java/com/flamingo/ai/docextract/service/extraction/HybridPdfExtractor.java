package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.MalformedDocumentException;
import com.flamingo.ai.docextract.exception.ParserIncompatibilityException;
import com.flamingo.ai.docextract.service.extraction.PageBatchScheduler.BatchOutcome;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.DocumentMetadata;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import io.micrometer.core.annotation.Timed;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the PDF pipeline: native text layer per page, OCR of the largest embedded images,
 * and OCR of page screenshots for scanned pages.
 *
 * <p>Each call gets its own {@link ExtractionSession}; concurrent calls share nothing. An empty
 * combined text is a valid result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridPdfExtractor {

  private final MetadataResolver metadataResolver;
  private final PageBatchScheduler batchScheduler;
  private final PageResultAggregator aggregator;
  private final ExtractionConfig config;

  /**
   * Extracts the text of a PDF.
   *
   * @param buffer PDF bytes
   * @param options per-call settings
   * @return page-ordered text and run statistics
   * @throws MalformedDocumentException if the buffer is empty or lacks the {@code %PDF} signature
   * @throws ParserIncompatibilityException if nothing could be read and neither PDFBox nor the
   *     parse adapter could open the document
   */
  @Timed(value = "document.extract", description = "Time to extract text from a PDF")
  public ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options) {
    validate(buffer);

    try (ExtractionSession session = new ExtractionSession(buffer)) {
      DocumentMetadata metadata = metadataResolver.resolveMetadata(session);
      session.setMetadata(metadata);
      int totalPages = options.pagesToProcess(metadata.pageCount());
      log.info("Extracting {} of {} pages (page count from {}), image OCR {}",
          totalPages, metadata.pageCount(), metadata.source(),
          options.extractImageText() ? "enabled" : "disabled");

      BatchOutcome outcome = batchScheduler.process(session, totalPages, options);
      ExtractionResult result =
          aggregator.aggregate(
              outcome.pages(), totalPages, session.visionCallCount(), outcome.timedOut());

      logStats(result);

      ParserIncompatibilityException parserFailure = session.parserFailure();
      if (parserFailure != null) {
        if (result.isEmpty() && session.documentLoadFailed()) {
          log.error("No extraction strategy could read the document: {}",
              parserFailure.getMessage());
          throw parserFailure;
        }
        log.warn("Parse adapter failed but other strategies produced output: {}",
            parserFailure.getMessage());
      }
      return result;
    }
  }

  private void validate(DocumentBuffer buffer) {
    if (buffer == null || buffer.isEmpty()) {
      throw new MalformedDocumentException("Document buffer is empty");
    }
    if (!buffer.hasPdfSignature()) {
      throw new MalformedDocumentException(
          "Invalid PDF file: expected PDF header, got \"" + buffer.headerPreview() + "\"");
    }
  }

  private void logStats(ExtractionResult result) {
    double estimatedCost = result.visionCallCount() * config.getOcr().getCostPerCall();
    log.info("Extraction finished: {}/{} pages, {} vision calls (est. ${}), {} characters{}",
        result.pagesProcessed(), result.totalPages(), result.visionCallCount(),
        String.format(Locale.ROOT, "%.2f", estimatedCost), result.combinedText().length(),
        result.timedOut() ? ", timed out" : "");
  }
}
