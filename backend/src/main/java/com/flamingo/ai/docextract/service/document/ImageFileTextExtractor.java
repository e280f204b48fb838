package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Standalone image uploads. No OCR is run on them; the extracted text is a short description of
 * the file so that the upload still yields a searchable record.
 */
@Component
@Order(40)
public class ImageFileTextExtractor implements DocumentTextExtractor {

  static final Set<String> MIME_TYPES =
      Set.of(
          "image/jpeg",
          "image/jpg",
          "image/png",
          "image/gif",
          "image/webp",
          "image/bmp",
          "image/tiff");

  @Override
  public boolean supports(String mimeType) {
    return MIME_TYPES.contains(mimeType);
  }

  @Override
  public ExtractionResult extract(DocumentBuffer buffer, ExtractionOptions options) {
    String description =
        "Image file\n"
            + "File type: " + buffer.mimeType() + "\n"
            + "Size: " + buffer.size() + " bytes\n"
            + "Note: This is an image file. Text inside the image is not extracted.";
    return ExtractionResult.ofText(description);
  }
}
