package com.flamingo.ai.docextract.service.extraction.parsing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.SAXException;

/**
 * {@link DirectParser} backed by Apache Tika's {@link AutoDetectParser}.
 *
 * <p>Returns the body text under {@code text} and every Tika metadata name as a string entry, so
 * the page count arrives under {@code xmpTPg:NPages} for PDFs and {@code meta:page-count} for
 * Office formats.
 */
@Slf4j
public class TikaParserBackend implements DirectParser {

  /** No write limit on the body handler. */
  private static final int UNLIMITED = -1;

  private final String mimeTypeHint;

  public TikaParserBackend() {
    this(null);
  }

  /**
   * @param mimeTypeHint content type passed to Tika's detector, or {@code null} to auto-detect
   */
  public TikaParserBackend(String mimeTypeHint) {
    this.mimeTypeHint = mimeTypeHint;
  }

  @Override
  public String name() {
    return "tika";
  }

  @Override
  public Map<String, Object> parse(byte[] bytes) throws IOException {
    AutoDetectParser tikaParser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(UNLIMITED);
    Metadata metadata = new Metadata();
    if (mimeTypeHint != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeTypeHint);
    }

    try (InputStream in = new ByteArrayInputStream(bytes)) {
      tikaParser.parse(in, handler, metadata, new ParseContext());
    } catch (TikaException | SAXException e) {
      throw new IOException("Tika failed to parse document: " + e.getMessage(), e);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("text", handler.toString());
    for (String name : metadata.names()) {
      String value = metadata.get(name);
      if (value != null) {
        result.put(name, value);
      }
    }
    log.debug("Tika parsed {} bytes into {} metadata entries", bytes.length, result.size() - 1);
    return result;
  }
}
