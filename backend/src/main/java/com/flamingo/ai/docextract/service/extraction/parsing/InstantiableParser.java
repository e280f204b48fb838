package com.flamingo.ai.docextract.service.extraction.parsing;

import java.io.IOException;

/** Capability of a {@link ParserBackend} that has to be constructed around a document. */
public interface InstantiableParser extends ParserBackend {

  /**
   * Constructs a parser instance bound to the document.
   *
   * @param bytes raw document bytes
   * @return the instance; the caller closes it
   * @throws IOException if the document cannot be opened
   */
  ParserInstance newInstance(byte[] bytes) throws IOException;
}
