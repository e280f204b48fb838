package com.flamingo.ai.docextract.service.extraction.parsing;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * {@link InstantiableParser} backed by Apache PDFBox.
 *
 * <p>The constructed instance loads the document once and answers {@code getText()}, {@code
 * getInfo()} and {@code getPageCount()} asynchronously. Accessors run on the supplied executor
 * (the common fork-join pool by default); access to the underlying {@link PDDocument} is
 * serialised because PDFBox documents are not thread-safe.
 */
@Slf4j
public class PdfBoxParserBackend implements InstantiableParser {

  private final Executor executor;

  public PdfBoxParserBackend() {
    this(ForkJoinPool.commonPool());
  }

  public PdfBoxParserBackend(Executor executor) {
    this.executor = executor;
  }

  @Override
  public String name() {
    return "pdfbox";
  }

  @Override
  public ParserInstance newInstance(byte[] bytes) throws IOException {
    return new PdfBoxParserInstance(Loader.loadPDF(bytes), executor);
  }

  /** A loaded PDF exposed through asynchronous accessors. */
  static final class PdfBoxParserInstance implements AsyncAccessorInstance {

    private final PDDocument document;
    private final Executor executor;

    PdfBoxParserInstance(PDDocument document, Executor executor) {
      this.document = document;
      this.executor = executor;
    }

    @Override
    public CompletableFuture<String> getText() {
      return CompletableFuture.supplyAsync(
          () -> {
            synchronized (document) {
              try {
                return new PDFTextStripper().getText(document);
              } catch (IOException e) {
                throw new CompletionException(e);
              }
            }
          },
          executor);
    }

    @Override
    public CompletableFuture<Map<String, Object>> getInfo() {
      return CompletableFuture.supplyAsync(
          () -> {
            synchronized (document) {
              Map<String, Object> info = new LinkedHashMap<>();
              PDDocumentInformation information = document.getDocumentInformation();
              if (information != null) {
                for (String key : information.getMetadataKeys()) {
                  String value = information.getCustomMetadataValue(key);
                  if (value != null) {
                    info.put(key, value);
                  }
                }
              }
              info.put("pdf:PDFVersion", String.valueOf(document.getVersion()));
              return info;
            }
          },
          executor);
    }

    @Override
    public CompletableFuture<Integer> getPageCount() {
      return CompletableFuture.supplyAsync(
          () -> {
            synchronized (document) {
              return document.getNumberOfPages();
            }
          },
          executor);
    }

    @Override
    public void close() {
      synchronized (document) {
        try {
          document.close();
        } catch (IOException e) {
          log.warn("Failed to close PDFBox document: {}", e.getMessage());
        }
      }
    }
  }
}
