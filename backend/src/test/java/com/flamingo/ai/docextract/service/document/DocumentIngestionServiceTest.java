package com.flamingo.ai.docextract.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.DocumentProcessingException;
import com.flamingo.ai.docextract.exception.MalformedDocumentException;
import com.flamingo.ai.docextract.service.chunking.WordChunker;
import com.flamingo.ai.docextract.service.document.store.DocumentChunkStore;
import com.flamingo.ai.docextract.service.document.store.InMemoryDocumentChunkStore;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import com.flamingo.ai.docextract.service.extraction.model.PageResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentIngestionService")
class DocumentIngestionServiceTest {

  private static final DocumentBuffer PDF = DocumentBuffer.pdf("%PDF-1.7".getBytes());

  @Mock private DocumentTextExtractorRouter router;

  private ExtractionConfig config;
  private DocumentChunkStore store;
  private SimpleMeterRegistry meterRegistry;
  private DocumentIngestionService service;

  @BeforeEach
  void setUp() {
    config = new ExtractionConfig();
    store = new InMemoryDocumentChunkStore();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DocumentIngestionService(
            router, new WordChunker(config), store, config, meterRegistry);
  }

  @Test
  @DisplayName("Should chunk and store extracted text")
  void shouldChunkAndStore() {
    String text = "word ".repeat(1200).trim();
    when(router.extract(eq(PDF), any()))
        .thenReturn(new ExtractionResult(text, 3, 4, 4, List.of(PageResult.empty(1)), false));

    IngestionResult result = service.ingest("doc-1", PDF);

    assertThat(result.chunkCount()).isEqualTo(3);
    assertThat(result.characters()).isEqualTo(text.length());
    assertThat(result.visionCallCount()).isEqualTo(3);
    assertThat(result.pagesProcessed()).isEqualTo(4);
    assertThat(store.findChunks("doc-1")).hasSize(3);
    assertThat(meterRegistry.counter("document.processing.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should report the pages that produced a result when extraction was cut short")
  void shouldReportPagesProcessed() {
    when(router.extract(eq(PDF), any()))
        .thenReturn(
            new ExtractionResult(
                "partial text",
                0,
                2,
                5,
                List.of(PageResult.textOnly(1, "partial"), PageResult.textOnly(2, "text")),
                true));

    IngestionResult result = service.ingest("doc-8", PDF);

    assertThat(result.pagesProcessed()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should fail with an actionable message when no text is extracted")
  void shouldFailOnEmptyText() {
    when(router.extract(eq(PDF), any())).thenReturn(ExtractionResult.ofText(""));

    assertThatThrownBy(() -> service.ingest("doc-2", PDF))
        .isInstanceOf(DocumentProcessingException.class)
        .satisfies(
            e -> {
              DocumentProcessingException ex = (DocumentProcessingException) e;
              assertThat(ex.getDocumentId()).isEqualTo("doc-2");
              assertThat(ex.getUserMessage())
                  .isEqualTo(
                      "This document appears to be image-only or corrupted. "
                          + "Try uploading a text-based version.");
            });
    assertThat(store.findChunks("doc-2")).isEmpty();
    assertThat(meterRegistry.counter("document.processing.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should propagate typed extraction failures unchanged")
  void shouldPropagateTypedFailures() {
    MalformedDocumentException malformed =
        new MalformedDocumentException("Document buffer is empty");
    when(router.extract(eq(PDF), any())).thenThrow(malformed);

    assertThatThrownBy(() -> service.ingest("doc-3", PDF)).isSameAs(malformed);
  }

  @Test
  @DisplayName("Should wrap unexpected failures")
  void shouldWrapUnexpectedFailures() {
    when(router.extract(eq(PDF), any())).thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> service.ingest("doc-4", PDF))
        .isInstanceOf(DocumentProcessingException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should return stored text without re-extracting")
  void shouldReturnStoredText() {
    when(router.extract(eq(PDF), any())).thenReturn(ExtractionResult.ofText("stored words"));
    service.ingest("doc-5", PDF);

    String text = service.readOrReextract("doc-5", PDF);

    assertThat(text).isEqualTo("stored words");
    verify(router).extract(eq(PDF), any());
  }

  @Test
  @DisplayName("Should re-extract in fallback mode when chunks are missing")
  void shouldReextractInFallbackMode() {
    when(router.extract(
            eq(PDF),
            argThat(
                (ExtractionOptions options) ->
                    !options.extractImageText()
                        && options.maxPages() == ExtractionOptions.FALLBACK_MAX_PAGES)))
        .thenReturn(ExtractionResult.ofText("recovered text"));

    String text = service.readOrReextract("doc-6", PDF);

    assertThat(text).isEqualTo("recovered text");
    verify(router, never())
        .extract(eq(PDF), argThat((ExtractionOptions options) -> options.extractImageText()));
  }

  @Test
  @DisplayName("Should complete the async future with the ingestion result")
  void shouldIngestAsync() throws Exception {
    when(router.extract(eq(PDF), any())).thenReturn(ExtractionResult.ofText("async words"));

    IngestionResult result = service.ingestAsync("doc-7", PDF).get();

    assertThat(result.chunkCount()).isEqualTo(1);
  }
}
