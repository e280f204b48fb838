package com.flamingo.ai.docextract.service.document.store;

import com.flamingo.ai.docextract.service.extraction.model.TextChunk;
import java.util.List;
import java.util.Optional;

/** Storage for the text chunks of a document. */
public interface DocumentChunkStore {

  /** Replaces every stored chunk of {@code documentId} with {@code chunks}. */
  void replaceChunks(String documentId, List<TextChunk> chunks);

  /** Chunks of {@code documentId} in ordinal order; empty if none are stored. */
  List<TextChunk> findChunks(String documentId);

  /**
   * Concatenation of the stored chunks, separated by single spaces.
   *
   * @return the text, or empty when nothing is stored for the document
   */
  Optional<String> readFullText(String documentId);

  void deleteChunks(String documentId);
}
