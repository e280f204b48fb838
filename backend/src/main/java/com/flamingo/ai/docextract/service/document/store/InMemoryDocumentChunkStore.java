package com.flamingo.ai.docextract.service.document.store;

import com.flamingo.ai.docextract.service.extraction.model.TextChunk;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/** {@link DocumentChunkStore} kept in process memory. */
@Repository
@Slf4j
public class InMemoryDocumentChunkStore implements DocumentChunkStore {

  private final Map<String, List<TextChunk>> chunksByDocument = new ConcurrentHashMap<>();

  @Override
  public void replaceChunks(String documentId, List<TextChunk> chunks) {
    List<TextChunk> ordered =
        chunks.stream().sorted(Comparator.comparingInt(TextChunk::ordinal)).toList();
    chunksByDocument.put(documentId, ordered);
    log.debug("Stored {} chunks for document {}", ordered.size(), documentId);
  }

  @Override
  public List<TextChunk> findChunks(String documentId) {
    return chunksByDocument.getOrDefault(documentId, List.of());
  }

  @Override
  public Optional<String> readFullText(String documentId) {
    List<TextChunk> chunks = findChunks(documentId);
    if (chunks.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(chunks.stream().map(TextChunk::text).collect(Collectors.joining(" ")));
  }

  @Override
  public void deleteChunks(String documentId) {
    chunksByDocument.remove(documentId);
  }
}
