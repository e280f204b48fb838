package com.flamingo.ai.docextract.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docextract.service.extraction.model.ExtractionResult;
import com.flamingo.ai.docextract.service.extraction.model.PageResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PageResultAggregator")
class PageResultAggregatorTest {

  private final PageResultAggregator aggregator = new PageResultAggregator();

  @Test
  @DisplayName("Should render page and image markers in page order")
  void shouldRenderMarkersInPageOrder() {
    List<PageResult> pages =
        List.of(
            new PageResult(2, "Second", List.of("chart text", "logo text"), 2),
            PageResult.textOnly(1, "First"));

    String combined = aggregator.render(pages);

    assertThat(combined)
        .isEqualTo(
            "\n\n=== Page 1 ===\n\nFirst"
                + "\n\n=== Page 2 ===\n\nSecond"
                + "\n\n--- Images from Page 2 ---\n"
                + "\n[Image 1]:\nchart text\n"
                + "\n[Image 2]:\nlogo text\n");
  }

  @Test
  @DisplayName("Should omit the page marker for blank native text")
  void shouldOmitBlankPages() {
    List<PageResult> pages =
        List.of(
            PageResult.empty(1),
            new PageResult(2, "  ", List.of("only image"), 1),
            PageResult.textOnly(3, "Third"));

    String combined = aggregator.render(pages);

    assertThat(combined).doesNotContain("=== Page 1 ===").doesNotContain("=== Page 2 ===");
    assertThat(combined).contains("--- Images from Page 2 ---").contains("=== Page 3 ===");
  }

  @Test
  @DisplayName("Should produce an empty result for pages without text")
  void shouldProduceEmptyResult() {
    ExtractionResult result =
        aggregator.aggregate(List.of(PageResult.empty(1), PageResult.empty(2)), 2, 0, false);

    assertThat(result.isEmpty()).isTrue();
    assertThat(result.pagesProcessed()).isEqualTo(2);
    assertThat(result.totalPages()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should carry run statistics into the result")
  void shouldCarryStatistics() {
    ExtractionResult result =
        aggregator.aggregate(
            List.of(PageResult.textOnly(3, "c"), PageResult.textOnly(1, "a")), 5, 4, true);

    assertThat(result.pages()).extracting(PageResult::pageNumber).containsExactly(1, 3);
    assertThat(result.visionCallCount()).isEqualTo(4);
    assertThat(result.pagesProcessed()).isEqualTo(2);
    assertThat(result.totalPages()).isEqualTo(5);
    assertThat(result.timedOut()).isTrue();
  }
}
