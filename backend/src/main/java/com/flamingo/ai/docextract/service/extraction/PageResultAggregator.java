package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import com.flamingo.ai.docextract.service.extraction.model.PageResult;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Joins per-page results into the combined text of a document.
 *
 * <pre>
 * \n\n=== Page N ===\n\n&lt;native text&gt;
 * \n\n--- Images from Page N ---\n
 * \n[Image i]:\n&lt;image text&gt;\n
 * </pre>
 *
 * Pages appear in ascending order whatever order they finished in. Blank native text and pages
 * without image text omit their markers.
 */
@Component
public class PageResultAggregator {

  public ExtractionResult aggregate(
      List<PageResult> pages, int totalPages, int visionCallCount, boolean timedOut) {
    List<PageResult> ordered = sortByPage(pages);
    return new ExtractionResult(
        render(ordered), visionCallCount, ordered.size(), totalPages, ordered, timedOut);
  }

  /** Renders page and image markers for {@code pages} in page order. */
  public String render(List<PageResult> pages) {
    StringBuilder combined = new StringBuilder();
    for (PageResult page : sortByPage(pages)) {
      if (!page.nativeText().isBlank()) {
        combined
            .append("\n\n=== Page ")
            .append(page.pageNumber())
            .append(" ===\n\n")
            .append(page.nativeText());
      }
      if (!page.imageTexts().isEmpty()) {
        combined.append("\n\n--- Images from Page ").append(page.pageNumber()).append(" ---\n");
        int index = 1;
        for (String imageText : page.imageTexts()) {
          combined
              .append("\n[Image ")
              .append(index++)
              .append("]:\n")
              .append(imageText)
              .append('\n');
        }
      }
    }
    return combined.toString();
  }

  private static List<PageResult> sortByPage(List<PageResult> pages) {
    return pages.stream().sorted(Comparator.comparingInt(PageResult::pageNumber)).toList();
  }
}
