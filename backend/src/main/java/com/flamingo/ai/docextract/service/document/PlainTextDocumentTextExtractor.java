package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Plain-text and Markdown uploads, decoded as UTF-8. */
@Component
@Order(30)
public class PlainTextDocumentTextExtractor implements DocumentTextExtractor {

  private static final Set<String> MIME_TYPES = Set.of("text/plain", "text/markdown");

  @Override
  public boolean supports(String mimeType) {
    return MIME_TYPES.contains(mimeType);
  }

  @Override
  public ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options) {
    return ExtractionResult.ofText(new String(buffer.bytes(), StandardCharsets.UTF_8));
  }
}
