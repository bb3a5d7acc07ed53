package com.flamingo.ai.workspace.service.embedding;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating text embeddings with the configured LangChain4j embedding model. */
@Service
@Slf4j
public class EmbeddingService {

  // OpenAI text-embedding-3-small has an 8192 token limit; one char per token is the
  // conservative estimate for dense CJK text.
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final WorkspaceConfig.Embedding config;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      Optional<EmbeddingModel> embeddingModel,
      WorkspaceConfig workspaceConfig,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel.orElse(null);
    this.config = workspaceConfig.getEmbedding();
    this.meterRegistry = meterRegistry;
  }

  /** Whether embeddings are enabled and a model is available. */
  public boolean isEnabled() {
    return config.isEnabled() && embeddingModel != null;
  }

  /** Model name recorded in vector metadata. */
  public String getModelName() {
    return config.getModelName();
  }

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector
   * @throws EmbeddingException when the provider call fails
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public List<Float> embedQuery(String query) {
    requireEnabled();
    String text = truncate(query, "Query");
    try {
      Response<Embedding> response = embeddingModel.embed(text);
      meterRegistry.counter("embedding.requests.success", "type", "query").increment();
      return toFloatList(response.content().vector());
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
      log.error("Query embedding failed ({} chars): {}", text.length(), e.getMessage(), e);
      throw new EmbeddingException("Query embedding failed", e);
    }
  }

  /**
   * Embeds passages in one provider call. The result has one vector per input, in input order.
   *
   * @param texts the passages to embed
   * @return list of embedding vectors
   * @throws EmbeddingException when the provider call fails or returns a short result
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public List<List<Float>> embedTexts(List<String> texts) {
    requireEnabled();
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), "Passage " + i)));
    }
    List<Embedding> embeddings;
    try {
      embeddings = embeddingModel.embedAll(segments).content();
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
      log.error("Batch embedding of {} passages failed: {}", texts.size(), e.getMessage(), e);
      throw new EmbeddingException("Batch embedding failed", e);
    }
    if (embeddings == null || embeddings.size() != texts.size()) {
      meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
      throw new EmbeddingException(
          "Embedding provider returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + texts.size()
              + " passages",
          null);
    }
    List<List<Float>> results = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      results.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    log.debug("Embedded {} passages", texts.size());
    return results;
  }

  private void requireEnabled() {
    if (!isEnabled()) {
      throw new IllegalStateException("Embedding is disabled for this workspace");
    }
  }

  private static String truncate(String text, String label) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          label,
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
