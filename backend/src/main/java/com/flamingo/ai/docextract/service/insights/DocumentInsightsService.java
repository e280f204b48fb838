package com.flamingo.ai.docextract.service.insights;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.PageResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Reading statistics, keyword frequencies and page bookmarks derived from extracted text. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentInsightsService {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_WORD = Pattern.compile("[^\\w\\u0600-\\u06FF]");
  private static final Pattern NON_LETTER = Pattern.compile("\\P{L}");
  private static final int MIN_KEYWORD_LENGTH = 2;
  private static final int MIN_TITLE_LETTERS = 3;

  private static final Set<String> ENGLISH_STOPWORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "that", "the", "to", "was", "will", "with", "this", "but",
          "they", "have", "had", "what", "said", "each", "which", "their", "time", "if", "up",
          "out", "many", "then", "them", "these", "so", "some", "her", "would", "make", "like",
          "into", "him", "two", "more", "very", "after", "words", "long", "than", "first", "been",
          "call", "who", "oil", "sit", "now", "find", "down", "day", "did", "get", "come", "made",
          "may", "part", "i", "we", "you", "she", "do", "can", "could", "should", "might", "must",
          "shall", "am", "were", "being", "having", "does", "doing");

  private static final Set<String> ARABIC_STOPWORDS =
      Set.of(
          "في", "من", "إلى", "على", "هذا", "هذه", "ذلك", "تلك", "التي", "الذي", "كان", "كانت",
          "يكون", "تكون", "كانوا", "يكونون", "له", "لها", "لهم", "لهن", "به", "بها", "بهم", "عنه",
          "عنها", "عنهم", "عنهن", "إليه", "إليها", "إليهم", "إليهن", "ال", "و", "أو", "لكن", "إذا",
          "إن", "أن", "ما", "لا", "لم", "لن", "ليس", "ليست", "لست", "لستم", "لستن", "لستما");

  private final ExtractionConfig config;

  /**
   * Computes reading statistics.
   *
   * @param text document text
   * @param pageCount page count; values below 1 count as 1
   */
  public ReadingInsights readingInsights(String text, int pageCount) {
    String value = text == null ? "" : text;
    int words = words(value).size();
    int pages = Math.max(1, pageCount);
    int wordsPerMinute = Math.max(1, config.getInsights().getReadingWordsPerMinute());
    return new ReadingInsights(
        words,
        value.length(),
        pages,
        (int) Math.ceil((double) words / wordsPerMinute),
        (int) Math.round((double) words / pages));
  }

  /** Keyword frequencies with the configured default list size. */
  public List<KeywordFrequency> keywordFrequencies(String text) {
    return keywordFrequencies(text, config.getInsights().getDefaultTopKeywords());
  }

  /**
   * Counts keywords: lower-cased, punctuation stripped, stop words and one-character words
   * dropped.
   *
   * @param text document text
   * @param topN maximum entries returned
   * @return most frequent first; equal counts keep first-occurrence order
   */
  public List<KeywordFrequency> keywordFrequencies(String text, int topN) {
    if (text == null || text.isBlank() || topN <= 0) {
      return List.of();
    }
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String raw : words(text)) {
      String word = NON_WORD.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
      if (word.length() < MIN_KEYWORD_LENGTH || isStopword(word)) {
        continue;
      }
      counts.merge(word, 1, Integer::sum);
    }
    log.debug("Counted {} distinct keywords", counts.size());
    // Stable sort keeps first-occurrence order among equal counts.
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
        .limit(topN)
        .map(e -> new KeywordFrequency(e.getKey(), e.getValue()))
        .toList();
  }

  /**
   * One bookmark per page, titled by the first line that has at least three letters.
   *
   * @param pages per-page extraction results
   * @return bookmarks in page order
   */
  public List<Bookmark> bookmarks(List<PageResult> pages) {
    int maxLength = config.getInsights().getMaxBookmarkTitleLength();
    List<Bookmark> bookmarks = new ArrayList<>(pages.size());
    pages.stream()
        .sorted(Comparator.comparingInt(PageResult::pageNumber))
        .forEach(page -> bookmarks.add(
            new Bookmark(title(page.nativeText(), page.pageNumber(), maxLength),
                page.pageNumber())));
    return bookmarks;
  }

  static String title(String pageText, int pageNumber, int maxLength) {
    if (pageText != null) {
      for (String line : pageText.split("\\R")) {
        String trimmed = line.trim();
        if (trimmed.length() >= MIN_TITLE_LETTERS
            && NON_LETTER.matcher(trimmed).replaceAll("").length() >= MIN_TITLE_LETTERS) {
          String collapsed = WHITESPACE.matcher(trimmed).replaceAll(" ");
          return collapsed.length() > maxLength ? collapsed.substring(0, maxLength) : collapsed;
        }
      }
    }
    return "Page " + pageNumber;
  }

  private static boolean isStopword(String word) {
    return ENGLISH_STOPWORDS.contains(word) || ARABIC_STOPWORDS.contains(word);
  }

  private static List<String> words(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? List.of() : List.of(WHITESPACE.split(trimmed));
  }
}
