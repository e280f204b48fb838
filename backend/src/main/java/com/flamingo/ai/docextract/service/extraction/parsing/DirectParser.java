package com.flamingo.ai.docextract.service.extraction.parsing;

import java.io.IOException;
import java.util.Map;

/** Capability of a {@link ParserBackend} that parses a whole document in one call. */
public interface DirectParser extends ParserBackend {

  /**
   * Parses the document.
   *
   * @param bytes raw document bytes
   * @return property bag with the extracted text and whatever metadata the library reports
   * @throws RequiresInstantiationException if the library can only be used after construction
   * @throws IOException if the document cannot be read
   */
  Map<String, Object> parse(byte[] bytes) throws IOException;
}
