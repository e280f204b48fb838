package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Fixed-size word segment of a document's text, the unit handed to chunk storage.
 *
 * @param text chunk text, trimmed
 * @param ordinal 0-based position of the chunk within the document
 */
public record TextChunk(String text, int ordinal) {

  public int wordCount() {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
