package com.flamingo.ai.docextract.service.extraction.model;

import java.util.Map;

/**
 * Page count and basic document information computed once per extraction call.
 *
 * @param pageCount number of pages, never below 1
 * @param info document information dictionary (title, author, producer, …)
 * @param formatVersion file format version such as {@code 1.7}, or {@code null} if unknown
 * @param source tier that produced {@code pageCount}
 */
public record DocumentMetadata(
    int pageCount, Map<String, String> info, String formatVersion, MetadataSource source) {

  public DocumentMetadata {
    pageCount = Math.max(1, pageCount);
    info = info == null ? Map.of() : Map.copyOf(info);
  }

  public static DocumentMetadata singlePage() {
    return new DocumentMetadata(1, Map.of(), null, MetadataSource.DEFAULT);
  }
}
