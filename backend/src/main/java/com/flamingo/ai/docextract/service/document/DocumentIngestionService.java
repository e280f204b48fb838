package com.flamingo.ai.docextract.service.document;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.DocumentProcessingException;
import com.flamingo.ai.docextract.service.chunking.WordChunker;
import com.flamingo.ai.docextract.service.document.store.DocumentChunkStore;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import com.flamingo.ai.docextract.service.extraction.model.TextChunk;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Extracts an uploaded document, chunks its text and stores the chunks. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  static final String NO_TEXT_USER_MESSAGE =
      "This document appears to be image-only or corrupted. "
          + "Try uploading a text-based version.";

  private final DocumentTextExtractorRouter extractorRouter;
  private final WordChunker wordChunker;
  private final DocumentChunkStore chunkStore;
  private final ExtractionConfig config;
  private final MeterRegistry meterRegistry;

  /** Ingests with the configured default options. */
  public IngestionResult ingest(String documentId, DocumentBuffer buffer) {
    return ingest(documentId, buffer, ExtractionOptions.from(config));
  }

  /**
   * Extracts, chunks and stores a document, replacing any chunks stored for it before.
   *
   * @param documentId caller's document identifier
   * @param buffer document bytes and MIME type
   * @param options extraction settings
   * @return ingestion summary
   * @throws DocumentProcessingException if the document yields no text or extraction fails
   */
  public IngestionResult ingest(
      String documentId, DocumentBuffer buffer, ExtractionOptions options) {
    log.info("Ingesting document {} ({})", documentId, buffer);
    try {
      ExtractionResult result = extractorRouter.extract(buffer, options);
      if (result.isEmpty()) {
        throw new DocumentProcessingException(
            documentId, "No text could be extracted from document " + documentId,
            NO_TEXT_USER_MESSAGE);
      }

      List<TextChunk> chunks = wordChunker.chunk(result.combinedText());
      chunkStore.replaceChunks(documentId, chunks);

      meterRegistry.counter("document.processing.success").increment();
      log.info("Document {} ingested: {} chunks, {} characters, {} vision calls",
          documentId, chunks.size(), result.combinedText().length(), result.visionCallCount());
      return new IngestionResult(
          documentId,
          chunks.size(),
          result.combinedText().length(),
          result.visionCallCount(),
          result.pagesProcessed());
    } catch (DocumentProcessingException e) {
      log.error("Failed to process document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("document.processing.failure").increment();
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to process document {}: {}", documentId, e.getMessage(), e);
      meterRegistry.counter("document.processing.failure").increment();
      throw new DocumentProcessingException(
          documentId, "Extraction failed for document " + documentId + ": " + e.getMessage(), e);
    }
  }

  /**
   * Runs {@link #ingest(String, DocumentBuffer)} on the document executor.
   *
   * @return future completed with the summary, or exceptionally with the ingestion failure
   */
  @Async("documentProcessingExecutor")
  public CompletableFuture<IngestionResult> ingestAsync(String documentId, DocumentBuffer buffer) {
    return CompletableFuture.completedFuture(ingest(documentId, buffer));
  }

  /**
   * Returns the stored text of a document, re-extracting it in fallback mode (no OCR, first 50
   * pages) when no chunks are stored.
   *
   * @param documentId caller's document identifier
   * @param buffer original upload, used only when the chunks are missing
   * @return stored or freshly extracted text
   */
  public String readOrReextract(String documentId, DocumentBuffer buffer) {
    Optional<String> stored = chunkStore.readFullText(documentId);
    if (stored.isPresent() && !stored.get().isBlank()) {
      return stored.get();
    }
    log.warn("No stored chunks for document {}, re-extracting in fallback mode", documentId);
    ingest(documentId, buffer, ExtractionOptions.fallback(config));
    return chunkStore.readFullText(documentId).orElse("");
  }
}
