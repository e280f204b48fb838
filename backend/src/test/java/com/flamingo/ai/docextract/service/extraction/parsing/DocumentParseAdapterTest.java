package com.flamingo.ai.docextract.service.extraction.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docextract.exception.MalformedDocumentException;
import com.flamingo.ai.docextract.exception.ParserIncompatibilityException;
import com.flamingo.ai.docextract.service.extraction.model.DocumentBuffer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentParseAdapter")
class DocumentParseAdapterTest {

  private static final DocumentBuffer PDF =
      DocumentBuffer.pdf("%PDF-1.7 fake body".getBytes(StandardCharsets.US_ASCII));

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("Should reject empty buffer")
    void shouldRejectEmptyBuffer() {
      DocumentParseAdapter adapter = new DocumentParseAdapter(direct(Map.of("text", "x")));

      assertThatThrownBy(() -> adapter.parse(DocumentBuffer.pdf(new byte[0])))
          .isInstanceOf(MalformedDocumentException.class);
    }

    @Test
    @DisplayName("Should reject PDF without %PDF signature")
    void shouldRejectPdfWithoutSignature() {
      DocumentParseAdapter adapter = new DocumentParseAdapter(direct(Map.of("text", "x")));
      DocumentBuffer notPdf = DocumentBuffer.pdf("<html>".getBytes(StandardCharsets.US_ASCII));

      assertThatThrownBy(() -> adapter.parse(notPdf))
          .isInstanceOf(MalformedDocumentException.class)
          .hasMessageContaining("<htm");
    }
  }

  @Nested
  @DisplayName("Direct call")
  class DirectCall {

    @Test
    @DisplayName("Should normalise text and page count of a direct parser")
    void shouldNormaliseDirectResult() {
      DocumentParseAdapter adapter =
          new DocumentParseAdapter(
              direct(Map.of("text", "hello world", "numpages", 3, "Title", "Report")));

      NormalizedParseResult result = adapter.parse(PDF);

      assertThat(result.text()).isEqualTo("hello world");
      assertThat(result.pageCount()).isEqualTo(3);
      assertThat(result.info()).containsEntry("Title", "Report");
      assertThat(result.metadata()).doesNotContainKey("text");
    }

    @Test
    @DisplayName("Should treat empty text as a normal result")
    void shouldReturnEmptyText() {
      DocumentParseAdapter adapter = new DocumentParseAdapter(direct(Map.of("text", "")));

      NormalizedParseResult result = adapter.parse(PDF);

      assertThat(result.text()).isEmpty();
      assertThat(result.hasPageCount()).isFalse();
    }
  }

  @Nested
  @DisplayName("Construct then probe")
  class ConstructThenProbe {

    @Test
    @DisplayName("Should construct when the direct call requires instantiation")
    void shouldFallBackToInstantiation() {
      AtomicBoolean closed = new AtomicBoolean();
      DocumentParseAdapter adapter =
          new DocumentParseAdapter(
              new HybridBackend(
                  new AsyncInstance(
                      CompletableFuture.completedFuture("async text"),
                      CompletableFuture.completedFuture(Map.of("Author", "Ada")),
                      CompletableFuture.completedFuture(4),
                      closed)));

      NormalizedParseResult result = adapter.parse(PDF);

      assertThat(result.text()).isEqualTo("async text");
      assertThat(result.pageCount()).isEqualTo(4);
      assertThat(result.info()).containsEntry("Author", "Ada");
      assertThat(closed).isTrue();
    }

    @Test
    @DisplayName("Should skip a failing accessor and keep the others")
    void shouldSkipFailingAccessor() {
      DocumentParseAdapter adapter =
          new DocumentParseAdapter(
              instantiable(
                  new AsyncInstance(
                      CompletableFuture.failedFuture(new IllegalStateException("no text")),
                      CompletableFuture.completedFuture(Map.of()),
                      CompletableFuture.completedFuture(7),
                      new AtomicBoolean())));

      NormalizedParseResult result = adapter.parse(PDF);

      assertThat(result.text()).isEmpty();
      assertThat(result.pageCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should read synchronous properties of a text-bearing instance")
    void shouldReadSynchronousProperties() {
      TextBearingInstance instance = () -> Map.of("content", "sync text", "pages", List.of(1, 2));
      DocumentParseAdapter adapter = new DocumentParseAdapter(instantiable(instance));

      NormalizedParseResult result = adapter.parse(PDF);

      assertThat(result.text()).isEqualTo("sync text");
      assertThat(result.pageCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should throw ParserIncompatibilityException when every strategy fails")
    void shouldThrowWhenNothingAnswers() {
      InstantiableParser broken =
          new InstantiableParser() {
            @Override
            public ParserInstance newInstance(byte[] bytes) throws IOException {
              throw new IOException("cannot open");
            }

            @Override
            public String name() {
              return "broken";
            }
          };
      DocumentParseAdapter adapter = new DocumentParseAdapter(broken);

      assertThatThrownBy(() -> adapter.parse(PDF))
          .isInstanceOf(ParserIncompatibilityException.class)
          .hasMessageContaining("broken")
          .hasMessageContaining("cannot open");
    }

    @Test
    @DisplayName("Should throw ParserIncompatibilityException for a backend without capabilities")
    void shouldThrowForBackendWithoutCapabilities() {
      DocumentParseAdapter adapter = new DocumentParseAdapter(() -> "inert");

      assertThatThrownBy(() -> adapter.parse(PDF))
          .isInstanceOf(ParserIncompatibilityException.class);
    }
  }

  @Nested
  @DisplayName("Normalisation")
  class Normalisation {

    @Test
    @DisplayName("Should prefer keys in documented order")
    void shouldPreferFirstTextKey() {
      NormalizedParseResult result =
          DocumentParseAdapter.normalize(
              Map.of("content", "second", "text", "first", "xmpTPg:NPages", "5"));

      assertThat(result.text()).isEqualTo("first");
      assertThat(result.pageCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should read values nested under doc")
    void shouldReadNestedDocument() {
      NormalizedParseResult result =
          DocumentParseAdapter.normalize(
              Map.of("doc", Map.of("X-TIKA:content", "nested", "numPages", 2)));

      assertThat(result.text()).isEqualTo("nested");
      assertThat(result.pageCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should ignore non-positive page counts")
    void shouldIgnoreNonPositivePageCounts() {
      NormalizedParseResult result =
          DocumentParseAdapter.normalize(Map.of("numPages", 0, "Page-Count", "abc"));

      assertThat(result.hasPageCount()).isFalse();
    }
  }

  private static DirectParser direct(Map<String, Object> result) {
    return new DirectParser() {
      @Override
      public Map<String, Object> parse(byte[] bytes) {
        return result;
      }

      @Override
      public String name() {
        return "direct";
      }
    };
  }

  private static InstantiableParser instantiable(ParserInstance instance) {
    return new InstantiableParser() {
      @Override
      public ParserInstance newInstance(byte[] bytes) {
        return instance;
      }

      @Override
      public String name() {
        return "instantiable";
      }
    };
  }

  /** Direct call always asks for construction. */
  private static final class HybridBackend implements DirectParser, InstantiableParser {

    private final ParserInstance instance;

    HybridBackend(ParserInstance instance) {
      this.instance = instance;
    }

    @Override
    public Map<String, Object> parse(byte[] bytes) {
      throw new RequiresInstantiationException("construct me");
    }

    @Override
    public ParserInstance newInstance(byte[] bytes) {
      return instance;
    }

    @Override
    public String name() {
      return "hybrid";
    }
  }

  private record AsyncInstance(
      CompletableFuture<String> text,
      CompletableFuture<Map<String, Object>> info,
      CompletableFuture<Integer> pageCount,
      AtomicBoolean closed)
      implements AsyncAccessorInstance {

    @Override
    public CompletableFuture<String> getText() {
      return text;
    }

    @Override
    public CompletableFuture<Map<String, Object>> getInfo() {
      return info;
    }

    @Override
    public CompletableFuture<Integer> getPageCount() {
      return pageCount;
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
