package com.flamingo.ai.docextract.service.extraction.parsing;

/**
 * A document parser library as seen by {@link DocumentParseAdapter}.
 *
 * <p>Backends advertise how they can be called by implementing one or more capability
 * interfaces: {@link DirectParser} for a single parse call, {@link InstantiableParser} for
 * libraries that must be constructed around a document first. The adapter probes the capabilities
 * in a fixed order, so callers never depend on which shape a library happens to have.
 */
public interface ParserBackend {

  /** Short name used in logs and configuration. */
  String name();
}
