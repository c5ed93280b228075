package com.flamingo.ai.notionrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the Notion mirroring service. */
@SpringBootApplication
public class NotionRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotionRagApplication.class, args);
  }
}
