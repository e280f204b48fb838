package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Memoises whole-document parses by buffer identity for the lifetime of one extraction call.
 *
 * <p>Concurrent requests for the same buffer share a single parse: the first caller runs it, the
 * others wait for its outcome. A failed parse is remembered and rethrown to later callers rather
 * than retried.
 */
public final class DocumentParseCache {

  private final Map<DocumentBuffer, CompletableFuture<NormalizedParseResult>> entries =
      new IdentityHashMap<>();

  /**
   * Returns the cached parse of {@code buffer}, running {@code parser} if there is none yet.
   *
   * @throws RuntimeException whatever {@code parser} threw, for this and every later call
   */
  public NormalizedParseResult getOrParse(
      DocumentBuffer buffer, Function<DocumentBuffer, NormalizedParseResult> parser) {
    CompletableFuture<NormalizedParseResult> pending;
    boolean owner = false;
    synchronized (entries) {
      pending = entries.get(buffer);
      if (pending == null) {
        pending = new CompletableFuture<>();
        entries.put(buffer, pending);
        owner = true;
      }
    }

    if (owner) {
      try {
        pending.complete(parser.apply(buffer));
      } catch (RuntimeException e) {
        pending.completeExceptionally(e);
      }
    }

    try {
      return pending.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  public int size() {
    synchronized (entries) {
      return entries.size();
    }
  }
}
