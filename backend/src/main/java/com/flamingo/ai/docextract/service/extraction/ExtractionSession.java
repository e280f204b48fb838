package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.exception.ParserIncompatibilityException;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import com.flamingo.ai.docextract.service.extraction.model.DocumentMetadata;
import com.flamingo.ai.docextract.service.extraction.parsing.DocumentParseCache;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * All mutable state of one extraction call: the structural PDF handle, the whole-document parse
 * cache and the vision-call counter.
 *
 * <p>A session is created per document and closed when the call ends; nothing in it is shared with
 * other documents. The {@link PDDocument} is loaded on first use and every access to it goes
 * through {@link #withDocument}, which serialises callers because PDFBox documents are not
 * thread-safe.
 */
@Slf4j
public final class ExtractionSession implements AutoCloseable {

  /** Work performed against the loaded PDF. */
  @FunctionalInterface
  public interface DocumentWork<T> {
    T apply(PDDocument document) throws IOException;
  }

  private final DocumentBuffer buffer;
  private final DocumentParseCache parseCache = new DocumentParseCache();
  private final AtomicInteger visionCalls = new AtomicInteger();
  private final AtomicReference<ParserIncompatibilityException> parserFailure =
      new AtomicReference<>();
  private final ReentrantLock documentLock = new ReentrantLock();

  private PDDocument document; // guarded by documentLock
  private IOException loadFailure; // guarded by documentLock
  private boolean closed; // guarded by documentLock
  private volatile DocumentMetadata metadata = DocumentMetadata.singlePage();

  public ExtractionSession(DocumentBuffer buffer) {
    this.buffer = buffer;
  }

  public DocumentBuffer buffer() {
    return buffer;
  }

  public DocumentParseCache parseCache() {
    return parseCache;
  }

  public DocumentMetadata metadata() {
    return metadata;
  }

  public void setMetadata(DocumentMetadata metadata) {
    this.metadata = metadata;
  }

  /** Records one vision-model call and returns the running total. */
  public int recordVisionCall() {
    return visionCalls.incrementAndGet();
  }

  public int visionCallCount() {
    return visionCalls.get();
  }

  /** Remembers the first parse-adapter failure of the call. */
  public void recordParserFailure(ParserIncompatibilityException failure) {
    parserFailure.compareAndSet(null, failure);
  }

  public ParserIncompatibilityException parserFailure() {
    return parserFailure.get();
  }

  /**
   * Runs {@code work} against the loaded PDF while holding the document lock.
   *
   * @throws IOException if the document cannot be loaded (the failure is remembered and rethrown
   *     to later callers) or {@code work} fails
   */
  public <T> T withDocument(DocumentWork<T> work) throws IOException {
    documentLock.lock();
    try {
      return work.apply(loadDocument());
    } finally {
      documentLock.unlock();
    }
  }

  /** Whether the structural renderer was tried and could not open the document. */
  public boolean documentLoadFailed() {
    documentLock.lock();
    try {
      return loadFailure != null;
    } finally {
      documentLock.unlock();
    }
  }

  private PDDocument loadDocument() throws IOException {
    if (closed) {
      throw new IOException("Extraction session is closed");
    }
    if (document != null) {
      return document;
    }
    if (loadFailure != null) {
      throw new IOException("PDF could not be loaded: " + loadFailure.getMessage(), loadFailure);
    }
    try {
      document = Loader.loadPDF(buffer.bytes());
      return document;
    } catch (IOException | RuntimeException e) {
      loadFailure = e instanceof IOException io ? io : new IOException(e.getMessage(), e);
      log.warn("Structural PDF load failed: {}", e.getMessage());
      throw loadFailure;
    }
  }

  @Override
  public void close() {
    documentLock.lock();
    try {
      closed = true;
      if (document != null) {
        try {
          document.close();
        } catch (IOException e) {
          log.warn("Failed to close PDF document: {}", e.getMessage());
        }
        document = null;
      }
    } finally {
      documentLock.unlock();
    }
  }
}
