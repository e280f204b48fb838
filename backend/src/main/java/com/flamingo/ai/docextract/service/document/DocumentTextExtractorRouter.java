package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.exception.UnsupportedDocumentTypeException;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a document MIME type to the first {@link DocumentTextExtractor} that supports it.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentTextExtractorRouter {

  private final List<DocumentTextExtractor> extractors;

  /**
   * Returns the extractor for the given MIME type.
   *
   * @param mimeType document MIME type
   * @return selected extractor
   * @throws UnsupportedDocumentTypeException if no extractor supports the MIME type
   */
  public DocumentTextExtractor route(String mimeType) {
    return extractors.stream()
        .filter(e -> e.supports(mimeType))
        .findFirst()
        .orElseThrow(() -> new UnsupportedDocumentTypeException(mimeType));
  }

  /** Extracts {@code buffer} with the extractor for its MIME type. */
  public ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options) {
    DocumentTextExtractor extractor = route(buffer.mimeType());
    log.debug("Routing {} to {}", buffer, extractor.getClass().getSimpleName());
    return extractor.extract(buffer, options);
  }
}
