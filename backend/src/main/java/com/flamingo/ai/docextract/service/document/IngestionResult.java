package com.flamingo.ai.docextract.service.document;

/**
 * Summary of one ingestion.
 *
 * @param documentId caller's document identifier
 * @param chunkCount chunks written to the store
 * @param characters length of the extracted text
 * @param visionCallCount vision-model calls made during extraction
 * @param pagesProcessed pages that produced a result; fewer than the document has when {@code
 *     maxPages} or the timeout cut extraction short
 */
public record IngestionResult(
    String documentId, int chunkCount, int characters, int visionCallCount, int pagesProcessed) {}
