package com.flamingo.ai.docextract.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.UnsupportedDocumentTypeException;
import com.flamingo.ai.docextract.service.extraction.HybridPdfExtractor;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentTextExtractorRouter")
class DocumentTextExtractorRouterTest {

  @Mock private HybridPdfExtractor hybridPdfExtractor;

  private DocumentTextExtractorRouter router;
  private ExtractionOptions options;

  @BeforeEach
  void setUp() {
    router =
        new DocumentTextExtractorRouter(
            List.of(
                new PdfDocumentTextExtractor(hybridPdfExtractor),
                new TikaDocumentTextExtractor(),
                new PlainTextDocumentTextExtractor(),
                new ImageFileTextExtractor()));
    options = ExtractionOptions.from(new ExtractionConfig());
  }

  @Test
  @DisplayName("Should route each supported MIME type to its extractor")
  void shouldRouteByMimeType() {
    assertThat(router.route("application/pdf")).isInstanceOf(PdfDocumentTextExtractor.class);
    assertThat(
            router.route(
                "application/vnd.openxmlformats-officedocument.wordprocessingml.document"))
        .isInstanceOf(TikaDocumentTextExtractor.class);
    assertThat(router.route("application/msword")).isInstanceOf(TikaDocumentTextExtractor.class);
    assertThat(router.route("text/plain")).isInstanceOf(PlainTextDocumentTextExtractor.class);
    assertThat(router.route("text/markdown")).isInstanceOf(PlainTextDocumentTextExtractor.class);
    assertThat(router.route("image/webp")).isInstanceOf(ImageFileTextExtractor.class);
  }

  @Test
  @DisplayName("Should reject unsupported MIME types")
  void shouldRejectUnsupportedType() {
    assertThatThrownBy(() -> router.route("application/zip"))
        .isInstanceOf(UnsupportedDocumentTypeException.class)
        .hasMessageContaining("application/zip");
  }

  @Test
  @DisplayName("Should decode plain text as UTF-8")
  void shouldDecodePlainText() {
    DocumentBuffer buffer =
        new DocumentBuffer("Grüße aus Köln".getBytes(StandardCharsets.UTF_8), "text/plain");

    ExtractionResult result = router.extract(buffer, options);

    assertThat(result.combinedText()).isEqualTo("Grüße aus Köln");
    assertThat(result.visionCallCount()).isZero();
  }

  @Test
  @DisplayName("Should describe image uploads without OCR")
  void shouldDescribeImageFiles() {
    DocumentBuffer buffer = new DocumentBuffer(new byte[2048], "IMAGE/PNG");

    ExtractionResult result = router.extract(buffer, options);

    assertThat(result.combinedText()).contains("image/png").contains("2048 bytes");
    assertThat(result.visionCallCount()).isZero();
  }

  @Test
  @DisplayName("Should extract Word documents with Tika")
  void shouldExtractWordDocument() throws Exception {
    byte[] docx = TestDocx.withParagraphs("Meeting notes", "Action items follow");
    DocumentBuffer buffer =
        new DocumentBuffer(
            docx, "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    ExtractionResult result = router.extract(buffer, options);

    assertThat(result.combinedText()).contains("Meeting notes").contains("Action items follow");
  }
}
