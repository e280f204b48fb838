package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.DocumentProcessingException;
import com.flamingo.ai.docextract.exception.ParserIncompatibilityException;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.DocumentMetadata;
import com.flamingo.ai.docextract.service.extraction.model.MetadataSource;
import com.flamingo.ai.docextract.service.extraction.parsing.DocumentParseAdapter;
import com.flamingo.ai.docextract.service.extraction.parsing.NormalizedParseResult;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.springframework.stereotype.Service;

/**
 * Determines the page count and document information of a buffer.
 *
 * <p>Tiers, first success wins:
 *
 * <ol>
 *   <li>PDFBox page tree (exact).
 *   <li>Page count reported through {@link DocumentParseAdapter}.
 *   <li>{@code ceil(words / wordsPerPageEstimate)} when only text is available.
 *   <li>One page.
 * </ol>
 *
 * <p>Never throws: callers must be able to go on extracting text even when the page count is
 * unknown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataResolver {

  private final DocumentParseAdapter parseAdapter;
  private final ExtractionConfig config;

  /** Resolves metadata for a standalone buffer. */
  public DocumentMetadata resolveMetadata(DocumentBuffer buffer) {
    try (ExtractionSession session = new ExtractionSession(buffer)) {
      return resolveMetadata(session);
    }
  }

  /**
   * Resolves metadata within an extraction call, sharing the call's PDF handle and parse cache.
   *
   * @param session the extraction call
   * @return metadata with {@code pageCount >= 1}
   */
  public DocumentMetadata resolveMetadata(ExtractionSession session) {
    DocumentMetadata structural = readStructural(session);
    if (structural != null) {
      log.debug("Page count {} from document structure", structural.pageCount());
      return structural;
    }

    NormalizedParseResult parsed = parseQuietly(session);
    if (parsed != null && parsed.hasPageCount()) {
      log.debug("Page count {} reported by parser '{}'", parsed.pageCount(),
          parseAdapter.backendName());
      return new DocumentMetadata(
          parsed.pageCount(), parsed.info(), formatVersion(parsed), MetadataSource.PARSER);
    }

    if (parsed != null && parsed.hasText()) {
      int words = parsed.words().size();
      int wordsPerPage = Math.max(1, config.getPipeline().getWordsPerPageEstimate());
      int estimate = (int) Math.ceil((double) words / wordsPerPage);
      log.info("Estimated {} pages from {} words", Math.max(1, estimate), words);
      return new DocumentMetadata(
          estimate, parsed.info(), formatVersion(parsed), MetadataSource.WORD_ESTIMATE);
    }

    log.warn("Could not determine page count; assuming a single page");
    return DocumentMetadata.singlePage();
  }

  private DocumentMetadata readStructural(ExtractionSession session) {
    if (!session.buffer().hasPdfSignature()) {
      return null;
    }
    try {
      return session.withDocument(this::fromDocument);
    } catch (IOException | RuntimeException e) {
      log.warn("Structural metadata extraction failed, falling back to parser: {}",
          e.getMessage());
      return null;
    }
  }

  private DocumentMetadata fromDocument(PDDocument document) {
    int pages = document.getNumberOfPages();
    if (pages <= 0) {
      return null;
    }
    Map<String, String> info = new LinkedHashMap<>();
    PDDocumentInformation information = document.getDocumentInformation();
    if (information != null) {
      for (String key : information.getMetadataKeys()) {
        String value = information.getCustomMetadataValue(key);
        if (value != null && !value.isBlank()) {
          info.put(key, value);
        }
      }
    }
    return new DocumentMetadata(
        pages, info, String.valueOf(document.getVersion()), MetadataSource.STRUCTURAL);
  }

  private NormalizedParseResult parseQuietly(ExtractionSession session) {
    try {
      return session.parseCache().getOrParse(session.buffer(), parseAdapter::parse);
    } catch (ParserIncompatibilityException e) {
      session.recordParserFailure(e);
      log.warn("Parser could not read metadata: {}", e.getMessage());
    } catch (DocumentProcessingException e) {
      log.warn("Parser rejected document: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Unexpected parser failure while reading metadata: {}", e.getMessage());
    }
    return null;
  }

  private static String formatVersion(NormalizedParseResult parsed) {
    return parsed.info().get("pdf:PDFVersion");
  }
}
