package com.flamingo.ai.docextract.service.extraction.parsing;

import java.util.Map;

/** A {@link ParserInstance} whose results are available synchronously right after construction. */
public interface TextBearingInstance extends ParserInstance {

  /**
   * Returns the results computed during construction.
   *
   * @return property bag; may lack the text or page count if the library did not produce them
   */
  Map<String, Object> properties();
}
