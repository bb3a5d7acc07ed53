package com.flamingo.ai.workspace.service.rerank;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Okapi BM25 scored over the candidate set alone. Document frequencies and the average document
 * length are computed from the candidates of each call, so scores are only comparable within one
 * call.
 */
@Slf4j
public class Bm25Reranker implements Reranker {

  public static final String STRATEGY = "bm25";

  private static final Pattern TOKEN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

  private final double k1;
  private final double b;

  public Bm25Reranker(double k1, double b) {
    if (k1 < 0 || b < 0 || b > 1) {
      throw new IllegalArgumentException(
          "BM25 parameters out of range: k1=" + k1 + ", b=" + b + " (expected k1 >= 0, 0 <= b <= 1)");
    }
    this.k1 = k1;
    this.b = b;
  }

  @Override
  public String getStrategy() {
    return STRATEGY;
  }

  @Override
  public List<ScoredCandidate> rerank(
      String query, List<Candidate> candidates, int topN, Double threshold) {
    if (candidates.isEmpty() || topN <= 0) {
      return List.of();
    }
    int corpusSize = candidates.size();
    List<Map<String, Integer>> termFrequencies = new ArrayList<>(corpusSize);
    int[] lengths = new int[corpusSize];
    Map<String, Integer> documentFrequency = new HashMap<>();
    long totalLength = 0;
    for (int i = 0; i < corpusSize; i++) {
      List<String> terms = tokenize(candidates.get(i).content());
      lengths[i] = terms.size();
      totalLength += terms.size();
      Map<String, Integer> counts = new HashMap<>();
      for (String term : terms) {
        counts.merge(term, 1, Integer::sum);
      }
      termFrequencies.add(counts);
      for (String term : counts.keySet()) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }
    double avgdl = (double) totalLength / corpusSize;

    List<String> queryTerms = tokenize(query);
    List<ScoredCandidate> results = new ArrayList<>();
    for (int i = 0; i < corpusSize; i++) {
      double score =
          score(queryTerms, termFrequencies.get(i), lengths[i], avgdl, documentFrequency, corpusSize);
      if (threshold == null || score >= threshold) {
        results.add(new ScoredCandidate(candidates.get(i), score));
      }
    }
    results.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
    log.debug(
        "BM25 scored {} candidates, kept {}, top score {}",
        corpusSize,
        results.size(),
        results.isEmpty() ? "N/A" : String.format("%.3f", results.get(0).score()));
    return results.size() > topN ? List.copyOf(results.subList(0, topN)) : results;
  }

  private double score(
      List<String> queryTerms,
      Map<String, Integer> termFrequency,
      int length,
      double avgdl,
      Map<String, Integer> documentFrequency,
      int corpusSize) {
    double score = 0.0;
    for (String term : queryTerms) {
      Integer df = documentFrequency.get(term);
      if (df == null) {
        continue;
      }
      int tf = termFrequency.getOrDefault(term, 0);
      if (tf == 0) {
        continue;
      }
      double idf = Math.log((corpusSize - df + 0.5) / (df + 0.5) + 1.0);
      double lengthRatio = avgdl > 0 ? length / avgdl : 0.0;
      score += idf * tf * (k1 + 1) / (tf + k1 * (1 - b + b * lengthRatio));
    }
    return score;
  }

  /** Lower-cased {@code \w+} tokens. */
  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }
}
