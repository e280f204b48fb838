package com.flamingo.ai.docextract.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  private Pipeline pipeline = new Pipeline();
  private Ocr ocr = new Ocr();
  private Render render = new Render();
  private Chunking chunking = new Chunking();
  private Parser parser = new Parser();
  private Insights insights = new Insights();

  @Getter
  @Setter
  public static class Pipeline {
    /** Pages processed concurrently per batch; batches run one after another. */
    private int batchSize = 3;

    /** Upper bound on pages processed per document; 0 processes every page. */
    private int maxPages = 0;

    /** Whether embedded images and scanned pages are sent to the vision model. */
    private boolean extractImageText = true;

    /** Overall budget for one extraction call; finished pages are kept when it expires. */
    private Duration timeout = Duration.ofMinutes(5);

    /** Working assumption used when only the word count of a document is known. */
    private int wordsPerPageEstimate = 500;
  }

  @Getter
  @Setter
  public static class Ocr {
    /** Largest embedded images (by pixel area) sent to the vision model per page. */
    private int maxImagesPerPage = 2;

    /** Pages without images whose native text is shorter than this are treated as scanned. */
    private int scannedPageThreshold = 100;

    private String noTextSentinel = "NO_TEXT_FOUND";

    private int maxOutputTokens = 2048;

    private double temperature = 0.0;

    /** Estimated price of one vision call in USD, used only for log output. */
    private double costPerCall = 0.01;

    /** Embedded images larger than this once encoded are skipped. */
    private long maxImageBytes = 10 * 1024 * 1024L; // 10 MB
  }

  @Getter
  @Setter
  public static class Render {
    private boolean enabled = true;
    private float dpi = 150f;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int maxWords = 500;
  }

  @Getter
  @Setter
  public static class Parser {
    /** Parser library behind the parse adapter: "tika" (default) or "pdfbox". */
    private String backend = "tika";
  }

  @Getter
  @Setter
  public static class Insights {
    private int readingWordsPerMinute = 200;
    private int defaultTopKeywords = 20;
    private int maxBookmarkTitleLength = 100;
  }
}
