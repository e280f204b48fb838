package com.flamingo.ai.docextract.service.insights;

/**
 * Navigation entry for one page.
 *
 * @param title first meaningful line of the page, or {@code Page N}
 * @param page 1-based page number
 */
public record Bookmark(String title, int page) {}
