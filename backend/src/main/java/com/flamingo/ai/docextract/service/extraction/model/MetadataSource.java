package com.flamingo.ai.docextract.service.extraction.model;

/** Which resolution tier produced a {@link DocumentMetadata#pageCount()}. */
public enum MetadataSource {
  /** Page tree of the PDF, read by the structural renderer. */
  STRUCTURAL,
  /** Page count reported by the parse adapter. */
  PARSER,
  /** Estimated from the word count of the extracted text. */
  WORD_ESTIMATE,
  /** Nothing usable was found; one page is assumed. */
  DEFAULT
}
