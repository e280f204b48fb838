package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.exception.MalformedDocumentException;
import com.flamingo.ai.docextract.exception.ParserIncompatibilityException;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Presents one call contract over a {@link ParserBackend} whose calling shape is not fixed.
 *
 * <p>Probe order:
 *
 * <ol>
 *   <li>{@link DirectParser#parse} when the backend offers it.
 *   <li>If the direct call is unavailable or reports {@link RequiresInstantiationException}, {@link
 *       InstantiableParser#newInstance}, then the synchronous properties of a {@link
 *       TextBearingInstance}, then each accessor of an {@link AsyncAccessorInstance} in turn. Every
 *       source that answers contributes to the merged result; a failing accessor is skipped.
 * </ol>
 *
 * <p>An empty text is a normal result. Only an invalid file signature ({@link
 * MalformedDocumentException}) and the absence of any answering source ({@link
 * ParserIncompatibilityException}) are errors.
 *
 * <p>Stateless; one instance serves concurrent extraction calls.
 */
@Slf4j
public class DocumentParseAdapter {

  static final List<String> TEXT_KEYS = List.of("text", "content", "X-TIKA:content");

  static final List<String> PAGE_COUNT_KEYS =
      List.of("xmpTPg:NPages", "meta:page-count", "Page-Count", "numPages", "numpages", "pages",
          "Pages");

  private static final String NESTED_DOCUMENT_KEY = "doc";
  private static final long ACCESSOR_TIMEOUT_SECONDS = 60;

  private final ParserBackend backend;

  public DocumentParseAdapter(ParserBackend backend) {
    this.backend = backend;
  }

  public String backendName() {
    return backend.name();
  }

  /**
   * Parses the buffer with the configured backend.
   *
   * @param buffer document to parse
   * @return normalised result, possibly with empty text
   * @throws MalformedDocumentException if the buffer is empty or a PDF lacks the {@code %PDF}
   *     signature
   * @throws ParserIncompatibilityException if no way of calling the backend produced a result
   */
  public NormalizedParseResult parse(DocumentBuffer buffer) {
    validate(buffer);

    Exception lastFailure = null;

    if (backend instanceof DirectParser direct) {
      try {
        Map<String, Object> raw = direct.parse(buffer.bytes());
        log.debug("Parser '{}' answered the direct call", backend.name());
        return normalize(raw);
      } catch (RequiresInstantiationException e) {
        log.debug("Parser '{}' must be constructed: {}", backend.name(), e.getMessage());
        lastFailure = e;
      } catch (Exception e) {
        log.warn("Direct call to parser '{}' failed: {}", backend.name(), e.getMessage());
        lastFailure = e;
      }
    }

    if (backend instanceof InstantiableParser instantiable) {
      try (ParserInstance instance = instantiable.newInstance(buffer.bytes())) {
        Map<String, Object> merged = probe(instance);
        if (!merged.isEmpty()) {
          return normalize(merged);
        }
        log.warn("Parser '{}' instance exposed no usable accessor", backend.name());
      } catch (Exception e) {
        log.warn("Constructing parser '{}' failed: {}", backend.name(), e.getMessage());
        lastFailure = e;
      }
    }

    String message = "Parser '" + backend.name() + "' could not be invoked by any known strategy";
    throw lastFailure == null
        ? new ParserIncompatibilityException(message)
        : new ParserIncompatibilityException(
            message + ": " + lastFailure.getMessage(), lastFailure);
  }

  private void validate(DocumentBuffer buffer) {
    if (buffer == null || buffer.isEmpty()) {
      throw new MalformedDocumentException("Document buffer is empty");
    }
    if (buffer.isPdf() && !buffer.hasPdfSignature()) {
      throw new MalformedDocumentException(
          "Invalid PDF file: expected PDF header, got \"" + buffer.headerPreview() + "\"");
    }
  }

  private Map<String, Object> probe(ParserInstance instance) {
    Map<String, Object> merged = new LinkedHashMap<>();

    if (instance instanceof TextBearingInstance textBearing) {
      Map<String, Object> properties = textBearing.properties();
      if (properties != null) {
        putAllNonNull(merged, properties);
      }
    }

    if (instance instanceof AsyncAccessorInstance accessors) {
      if (findFirst(merged, TEXT_KEYS) == null) {
        String text = await(accessors.getText(), "getText");
        if (text != null) {
          merged.put("text", text);
        }
      }
      Map<String, Object> info = await(accessors.getInfo(), "getInfo");
      if (info != null) {
        info.forEach(merged::putIfAbsent);
      }
      if (readPageCount(merged) == null) {
        Integer pages = await(accessors.getPageCount(), "getPageCount");
        if (pages != null) {
          merged.put("numPages", pages);
        }
      }
    }
    merged.values().removeIf(v -> v == null);
    return merged;
  }

  private <T> T await(CompletableFuture<T> future, String accessor) {
    if (future == null) {
      return null;
    }
    try {
      return future.get(ACCESSOR_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for {}() of parser '{}'", accessor, backend.name());
      return null;
    } catch (ExecutionException | TimeoutException e) {
      Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
      log.warn("{}() of parser '{}' failed: {}", accessor, backend.name(), cause.getMessage());
      return null;
    }
  }

  /**
   * Maps a raw property bag onto {@link NormalizedParseResult}. Values nested under {@code doc}
   * are consulted when the top level lacks them.
   */
  static NormalizedParseResult normalize(Map<String, Object> raw) {
    if (raw == null || raw.isEmpty()) {
      return NormalizedParseResult.empty();
    }
    Map<String, Object> nested = nestedDocument(raw);

    Object text = findFirst(raw, TEXT_KEYS);
    if (text == null && nested != null) {
      text = findFirst(nested, TEXT_KEYS);
    }
    Integer pageCount = readPageCount(raw);
    if (pageCount == null && nested != null) {
      pageCount = readPageCount(nested);
    }

    Map<String, String> info = new LinkedHashMap<>();
    Map<String, Object> metadata = new LinkedHashMap<>();
    raw.forEach(
        (key, value) -> {
          if (key == null
              || value == null
              || TEXT_KEYS.contains(key)
              || NESTED_DOCUMENT_KEY.equals(key)) {
            return;
          }
          if (value instanceof String s) {
            info.put(key, s);
          } else {
            metadata.put(key, value);
          }
        });

    return new NormalizedParseResult(
        text instanceof String s ? s : "", pageCount, info, metadata);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> nestedDocument(Map<String, Object> raw) {
    Object doc = raw.get(NESTED_DOCUMENT_KEY);
    return doc instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
  }

  private static Object findFirst(Map<String, Object> raw, List<String> keys) {
    for (String key : keys) {
      Object value = raw.get(key);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  static Integer readPageCount(Map<String, Object> raw) {
    for (String key : PAGE_COUNT_KEYS) {
      Integer count = toPositiveInt(raw.get(key));
      if (count != null) {
        return count;
      }
    }
    return null;
  }

  private static Integer toPositiveInt(Object value) {
    if (value instanceof Number number) {
      return number.intValue() > 0 ? number.intValue() : null;
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty() ? null : collection.size();
    }
    if (value instanceof String s) {
      try {
        int parsed = Integer.parseInt(s.trim());
        return parsed > 0 ? parsed : null;
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static void putAllNonNull(Map<String, Object> target, Map<String, Object> source) {
    source.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            target.put(key, value);
          }
        });
  }
}
