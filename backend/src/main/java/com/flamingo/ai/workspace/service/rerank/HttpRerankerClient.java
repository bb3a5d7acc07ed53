package com.flamingo.ai.workspace.service.rerank;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.workspace.config.WorkspaceConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for rerank services that accept {@code {model, query, documents}}. Encapsulates all
 * WebClient communication with the service.
 */
@Slf4j
public class HttpRerankerClient {

  private final WebClient webClient;
  private final String path;
  private final String modelName;
  private final int readTimeoutMs;

  public HttpRerankerClient(WorkspaceConfig.Reranking.Http http) {
    this(http, WebClient.builder());
  }

  HttpRerankerClient(WorkspaceConfig.Reranking.Http http, WebClient.Builder builder) {
    if (http.getBaseUrl() == null || http.getBaseUrl().isBlank()) {
      throw new IllegalStateException(
          "Rerank base URL is required. Set workspace.reranking.http.base-url (RERANK_BASE_URL).");
    }
    this.path = http.getPath() == null ? "" : http.getPath();
    this.modelName = http.getModelName();
    this.readTimeoutMs = http.getReadTimeoutMs();
    builder
        .baseUrl(http.getBaseUrl())
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024));
    if (http.getApiKey() != null && !http.getApiKey().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + http.getApiKey());
    }
    this.webClient = builder.build();
    log.info("HTTP reranker client initialized: baseUrl={}, model={}", http.getBaseUrl(), modelName);
  }

  /**
   * Scores documents against a query.
   *
   * @param topN forwarded as {@code top_n} when not null
   * @param threshold forwarded as {@code score_threshold} when not null
   * @return results with the index into {@code documents} and the score, in response order
   */
  public List<RerankResult> rerank(
      String query, List<String> documents, Integer topN, Double threshold) {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("model", modelName);
    request.put("query", query);
    request.put("documents", documents);
    if (topN != null) {
      request.put("top_n", topN);
    }
    if (threshold != null) {
      request.put("score_threshold", threshold);
    }
    JsonNode response =
        webClient
            .post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();
    return parse(response);
  }

  /** Accepts {@code {"docs": [...]}}, {@code {"results": [...]}} or a bare array. */
  static List<RerankResult> parse(JsonNode response) {
    if (response == null) {
      throw new IllegalStateException("Empty rerank response");
    }
    JsonNode items = response;
    if (!response.isArray()) {
      items = response.has("docs") ? response.get("docs") : response.get("results");
    }
    if (items == null || !items.isArray()) {
      throw new IllegalStateException("Unrecognized rerank response: " + response);
    }
    List<RerankResult> results = new ArrayList<>(items.size());
    for (JsonNode item : items) {
      JsonNode score = item.has("score") ? item.get("score") : item.get("relevance_score");
      if (!item.has("index") || score == null) {
        throw new IllegalStateException("Rerank result without index or score: " + item);
      }
      results.add(new RerankResult(item.get("index").asInt(), score.asDouble()));
    }
    return results;
  }

  /** Rerank response element. */
  public record RerankResult(int index, double score) {}
}
