package com.flamingo.ai.docextract.service.extraction.page;

import com.flamingo.ai.docextract.exception.ParserIncompatibilityException;
import com.flamingo.ai.docextract.service.extraction.ExtractionSession;
import com.flamingo.ai.docextract.service.extraction.parsing.DocumentParseAdapter;
import com.flamingo.ai.docextract.service.extraction.parsing.NormalizedParseResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Service;

/**
 * Extracts the native text layer of a single page.
 *
 * <p>Primary path: PDFBox text runs of the page joined with single spaces. When PDFBox cannot read
 * the document, the whole document is parsed once through {@link DocumentParseAdapter} (cached in
 * the session) and the page is approximated by a proportional slice of its words. The slice does
 * not follow real page boundaries.
 *
 * <p>Never throws; a page that cannot be read yields an empty string.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageTextExtractor {

  private final DocumentParseAdapter parseAdapter;

  /**
   * Returns the text of {@code pageNumber}.
   *
   * @param session the extraction call
   * @param pageNumber 1-based page number
   * @return page text, or {@code ""} if none could be obtained
   */
  public String extractPageText(ExtractionSession session, int pageNumber) {
    try {
      String text = session.withDocument(document -> readPage(document, pageNumber));
      log.debug("Extracted {} characters from page {} using PDFBox", text.length(), pageNumber);
      return text;
    } catch (IOException | RuntimeException e) {
      log.warn("PDFBox extraction failed for page {}, falling back to whole-document parse: {}",
          pageNumber, e.getMessage());
    }
    return extractBySlicing(session, pageNumber);
  }

  private String readPage(PDDocument document, int pageNumber) throws IOException {
    if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
      throw new IOException(
          "Page " + pageNumber + " out of range (1.." + document.getNumberOfPages() + ")");
    }
    TextRunStripper stripper = new TextRunStripper();
    stripper.setStartPage(pageNumber);
    stripper.setEndPage(pageNumber);
    stripper.getText(document);
    return stripper.joinedRuns();
  }

  private String extractBySlicing(ExtractionSession session, int pageNumber) {
    NormalizedParseResult parsed;
    try {
      parsed = session.parseCache().getOrParse(session.buffer(), parseAdapter::parse);
    } catch (ParserIncompatibilityException e) {
      session.recordParserFailure(e);
      log.error("No parser strategy worked for page {}: {}", pageNumber, e.getMessage());
      return "";
    } catch (RuntimeException e) {
      log.error("Whole-document parse failed for page {}: {}", pageNumber, e.getMessage());
      return "";
    }

    List<String> words = parsed.words();
    if (words.isEmpty()) {
      log.warn("Parser returned no text for page {}; document may be image-only", pageNumber);
      return "";
    }
    int totalPages =
        parsed.hasPageCount() ? parsed.pageCount() : session.metadata().pageCount();
    String pageText = slice(words, pageNumber, totalPages);
    log.debug("Approximated page {} with {} characters (split of {} words over {} pages)",
        pageNumber, pageText.length(), words.size(), totalPages);
    return pageText;
  }

  /**
   * Proportional word slice for {@code pageNumber}: {@code ceil(words / totalPages)} words per
   * page.
   */
  static String slice(List<String> words, int pageNumber, int totalPages) {
    if (words.isEmpty() || pageNumber < 1) {
      return "";
    }
    int wordsPerPage = (int) Math.ceil((double) words.size() / Math.max(1, totalPages));
    long start = (long) (pageNumber - 1) * wordsPerPage;
    if (start >= words.size()) {
      return "";
    }
    int end = (int) Math.min((long) pageNumber * wordsPerPage, words.size());
    return String.join(" ", words.subList((int) start, end));
  }

  /** Collects the word runs PDFBox emits for the selected pages. */
  private static final class TextRunStripper extends PDFTextStripper {

    private final List<String> runs = new ArrayList<>();

    TextRunStripper() {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
      if (text != null && !text.isBlank()) {
        runs.add(text.strip());
      }
    }

    String joinedRuns() {
      return String.join(" ", runs);
    }
  }
}
