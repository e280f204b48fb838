package com.flamingo.ai.docextract.service.insights;

public record KeywordFrequency(String word, int count) {}
