package com.flamingo.ai.docextract.service.extraction.parsing;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** A {@link ParserInstance} whose results are produced on demand by asynchronous accessors. */
public interface AsyncAccessorInstance extends ParserInstance {

  CompletableFuture<String> getText();

  CompletableFuture<Map<String, Object>> getInfo();

  CompletableFuture<Integer> getPageCount();
}
