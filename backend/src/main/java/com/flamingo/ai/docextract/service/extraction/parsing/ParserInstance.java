package com.flamingo.ai.docextract.service.extraction.parsing;

/**
 * A constructed parser bound to one document.
 *
 * <p>An instance exposes its results through {@link TextBearingInstance}, {@link
 * AsyncAccessorInstance}, both, or neither; {@link DocumentParseAdapter} probes for each.
 */
public interface ParserInstance extends AutoCloseable {

  @Override
  default void close() {}
}
