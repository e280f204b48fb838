package com.flamingo.ai.docextract.service.extraction.parsing;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the parser library behind {@link DocumentParseAdapter}. */
@Configuration
@Slf4j
public class ParserBackendConfig {

  @Bean
  public ParserBackend parserBackend(ExtractionConfig config) {
    String backend = config.getParser().getBackend();
    log.info("Using parser backend '{}'", backend);
    return switch (backend == null ? "" : backend.trim().toLowerCase(Locale.ROOT)) {
      case "pdfbox" -> new PdfBoxParserBackend();
      case "tika", "" -> new TikaParserBackend();
      default -> throw new IllegalStateException("Unknown parser backend: " + backend);
    };
  }

  @Bean
  public DocumentParseAdapter documentParseAdapter(ParserBackend parserBackend) {
    return new DocumentParseAdapter(parserBackend);
  }
}
