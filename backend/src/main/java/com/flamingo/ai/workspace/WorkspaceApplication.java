package com.flamingo.ai.workspace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Artifact workspace service: artifact storage, chunking and windowed hybrid retrieval. */
@SpringBootApplication
public class WorkspaceApplication {

  public static void main(String[] args) {
    SpringApplication.run(WorkspaceApplication.class, args);
  }
}
