package com.flamingo.ai.docextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the document text-extraction service. */
@SpringBootApplication
public class DocExtractApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocExtractApplication.class, args);
  }
}
