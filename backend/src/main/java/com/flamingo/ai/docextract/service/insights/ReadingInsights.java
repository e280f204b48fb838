package com.flamingo.ai.docextract.service.insights;

/**
 * Reading statistics of a document.
 *
 * @param totalWordCount whitespace-separated words
 * @param totalCharacterCount characters of the text, whitespace included
 * @param totalPages pages, at least 1
 * @param estimatedReadingMinutes minutes at the configured reading speed, rounded up
 * @param averageWordsPerPage words per page, rounded
 */
public record ReadingInsights(
    int totalWordCount,
    int totalCharacterCount,
    int totalPages,
    int estimatedReadingMinutes,
    int averageWordsPerPage) {}
