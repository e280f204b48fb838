package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.PageResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Runs {@link PageProcessor} over the pages of a document in consecutive batches.
 *
 * <p>Pages of a batch run concurrently on a pool of {@code batchSize} threads created for the call;
 * the next batch starts when the previous one has finished. A page that throws yields an empty
 * result. When the call deadline passes, finished pages are kept and the rest are cancelled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageBatchScheduler {

  private final PageProcessor pageProcessor;
  private final MeterRegistry meterRegistry;

  /**
   * Pages produced by a scheduling run.
   *
   * @param pages results in ascending page order
   * @param timedOut whether the deadline cut the run short
   */
  public record BatchOutcome(List<PageResult> pages, boolean timedOut) {

    public BatchOutcome {
      pages = List.copyOf(pages);
    }
  }

  /**
   * Processes pages {@code 1..totalPages}.
   *
   * @param session the extraction call
   * @param totalPages number of pages to process
   * @param options batch size and deadline
   * @return page results and the timeout flag
   */
  public BatchOutcome process(
      ExtractionSession session, int totalPages, ExtractionOptions options) {
    int batchSize = options.batchSize();
    long deadline = System.nanoTime() + options.timeout().toNanos();
    List<PageResult> results = new ArrayList<>(totalPages);
    boolean timedOut = false;

    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("page-batch-");
    threadFactory.setDaemon(true);
    ExecutorService executor = Executors.newFixedThreadPool(batchSize, threadFactory);
    try {
      for (int first = 1; first <= totalPages && !timedOut; first += batchSize) {
        int last = Math.min(first + batchSize - 1, totalPages);

        List<Future<PageResult>> futures = new ArrayList<>(last - first + 1);
        for (int page = first; page <= last; page++) {
          int pageNumber = page;
          futures.add(executor.submit(() -> processSafely(session, pageNumber, options)));
        }

        for (int i = 0; i < futures.size(); i++) {
          int pageNumber = first + i;
          Future<PageResult> future = futures.get(i);
          long remaining = Math.max(0L, deadline - System.nanoTime());
          try {
            results.add(future.get(remaining, TimeUnit.NANOSECONDS));
          } catch (TimeoutException e) {
            future.cancel(true);
            if (!timedOut) {
              log.warn("Extraction deadline of {} reached at page {}; keeping finished pages",
                  options.timeout(), pageNumber);
            }
            timedOut = true;
          } catch (ExecutionException e) {
            log.error("Page {} failed: {}", pageNumber, String.valueOf(e.getCause()));
            meterRegistry.counter("extraction.page.failures").increment();
            results.add(PageResult.empty(pageNumber));
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            log.warn("Extraction interrupted at page {}", pageNumber);
            timedOut = true;
            break;
          }
        }
        log.debug("Processed pages {}-{} of {}", first, last, totalPages);
      }
    } finally {
      executor.shutdownNow();
    }
    return new BatchOutcome(results, timedOut);
  }

  private PageResult processSafely(
      ExtractionSession session, int pageNumber, ExtractionOptions options) {
    try {
      return pageProcessor.processPage(session, pageNumber, options);
    } catch (RuntimeException e) {
      log.error("Error processing page {}: {}", pageNumber, e.getMessage(), e);
      meterRegistry.counter("extraction.page.failures").increment();
      return PageResult.empty(pageNumber);
    }
  }
}
