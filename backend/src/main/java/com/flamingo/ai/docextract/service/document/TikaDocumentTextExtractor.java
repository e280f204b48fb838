package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.exception.DocumentProcessingException;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Word documents (DOCX and legacy DOC), read as body text with Apache Tika. */
@Component
@Order(20)
@Slf4j
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

  static final Set<String> MIME_TYPES =
      Set.of(
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/msword");

  private final Tika tika;

  public TikaDocumentTextExtractor() {
    this.tika = new Tika();
    this.tika.setMaxStringLength(-1);
  }

  @Override
  public boolean supports(String mimeType) {
    return MIME_TYPES.contains(mimeType);
  }

  @Override
  public ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options) {
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, buffer.mimeType());
    try {
      String text = tika.parseToString(new ByteArrayInputStream(buffer.bytes()), metadata);
      log.debug("Tika extracted {} characters from {}", text.length(), buffer);
      return ExtractionResult.ofText(text.trim());
    } catch (IOException | TikaException e) {
      log.error("Tika extraction failed for {}: {}", buffer, e.getMessage());
      throw new DocumentProcessingException(
          null, "Failed to extract text from " + buffer.mimeType() + ": " + e.getMessage(), e);
    }
  }
}
