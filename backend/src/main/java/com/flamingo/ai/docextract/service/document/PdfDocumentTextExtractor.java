package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.service.extraction.HybridPdfExtractor;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** PDF uploads, handled by the hybrid text-layer and OCR pipeline. */
@Component
@Order(10)
@RequiredArgsConstructor
public class PdfDocumentTextExtractor implements DocumentTextExtractor {

  private final HybridPdfExtractor hybridPdfExtractor;

  @Override
  public boolean supports(String mimeType) {
    return DocumentBuffer.PDF.equals(mimeType);
  }

  @Override
  public ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options) {
    return hybridPdfExtractor.extract(buffer, options);
  }
}
