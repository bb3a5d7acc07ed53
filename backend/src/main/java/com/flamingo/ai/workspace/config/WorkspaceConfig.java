package com.flamingo.ai.workspace.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the artifact workspace. */
@Configuration
@ConfigurationProperties(prefix = "workspace")
@Getter
@Setter
public class WorkspaceConfig {

  /** Workspace id. Also used as the vector store collection name. */
  private String id = "default";

  private String name = "default";

  private Storage storage = new Storage();
  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private VectorStore vectorStore = new VectorStore();
  private Fulltext fulltext = new Fulltext();
  private HybridSearch hybridSearch = new HybridSearch();
  private Reranking reranking = new Reranking();

  @Getter
  @Setter
  public static class Storage {
    /** {@code local} or {@code s3}. */
    private String type = "local";

    private Local local = new Local();
    private S3 s3 = new S3();

    @Getter
    @Setter
    public static class Local {
      private String basePath = "./data/workspaces";
    }

    @Getter
    @Setter
    public static class S3 {
      private String bucket;
      private String prefix = "workspaces";
      private String endpoint;
      private String region = "us-east-1";
      private String accessKey;
      private String secretKey;
      private boolean pathStyleAccess = true;
    }
  }

  @Getter
  @Setter
  public static class Chunking {
    private boolean enabled = true;

    /** One of {@code character}, {@code sentence}, {@code markdown}, {@code smart}. */
    private String provider = "character";

    private int size = 1000;
    private int overlap = 100;
    private String separator = "\n";

    /** Token budget per chunk for the sentence chunker (whitespace tokens). */
    private int tokensPerChunk = 256;
  }

  @Getter
  @Setter
  public static class Embedding {
    private boolean enabled = true;

    /** {@code openai} or {@code ollama}. */
    private String provider = "openai";

    private String modelName = "text-embedding-3-small";
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private int dimensions = 1536;
    private int timeoutSeconds = 60;

    /** Maximum number of artifacts embedded concurrently. */
    private int maxConcurrent = 10;
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** {@code elasticsearch} or {@code memory}. */
    private String provider = "elasticsearch";

    private String indexPrefix = "workspace-vectors";
  }

  @Getter
  @Setter
  public static class Fulltext {
    private boolean enabled = false;
    private String indexPrefix = "workspace-fulltext";
    private String analyzer = "standard";
  }

  @Getter
  @Setter
  public static class HybridSearch {
    private boolean enabled = true;
    private int topK = 10;
    private double threshold = 0.8;
    private int preN = 3;
    private int nextN = 3;
  }

  @Getter
  @Setter
  public static class Reranking {
    /** {@code none}, {@code bm25} or {@code http}. */
    private String strategy = "bm25";

    private Bm25 bm25 = new Bm25();
    private Http http = new Http();

    @Getter
    @Setter
    public static class Bm25 {
      private double k1 = 1.2;
      private double b = 0.75;
    }

    @Getter
    @Setter
    public static class Http {
      private String baseUrl = "http://localhost:8000";
      private String path = "/rerank";
      private String apiKey;
      private String modelName = "bge-reranker-v2-m3";
      private int readTimeoutMs = 10000;
    }
  }
}
