package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Groups whole sentences into chunks of at most {@code tokensPerChunk} whitespace tokens.
 *
 * <p>Overlap keeps the same ratio to the chunk as the character overlap does to the character
 * chunk size, and is made of whole trailing sentences. A sentence longer than the token budget is
 * cut into token windows.
 */
public class SentenceChunker extends AbstractChunker {

  public static final String PROVIDER = "sentence";

  private final int tokensPerChunk;
  private final int overlapTokens;

  public SentenceChunker(WorkspaceConfig.Chunking config) {
    super(config);
    if (config.getTokensPerChunk() <= 0) {
      throw new IllegalArgumentException(
          "tokensPerChunk must be positive, got " + config.getTokensPerChunk());
    }
    this.tokensPerChunk = config.getTokensPerChunk();
    this.overlapTokens = (int) ((long) tokensPerChunk * chunkOverlap / chunkSize);
  }

  @Override
  public String getProvider() {
    return PROVIDER;
  }

  @Override
  protected List<String> split(String content) {
    List<String> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentTokens = 0;

    for (String sentence : sentences(content)) {
      String[] words = words(sentence);
      if (words.length > tokensPerChunk) {
        if (!current.isEmpty()) {
          chunks.add(String.join(" ", current));
          current.clear();
          currentTokens = 0;
        }
        for (int i = 0; i < words.length; i += tokensPerChunk) {
          chunks.add(
              String.join(
                  " ", Arrays.copyOfRange(words, i, Math.min(i + tokensPerChunk, words.length))));
        }
        continue;
      }
      if (currentTokens + words.length > tokensPerChunk && !current.isEmpty()) {
        chunks.add(String.join(" ", current));
        List<String> carried = new ArrayList<>();
        int carriedTokens = 0;
        for (int i = current.size() - 1; i >= 0; i--) {
          int n = words(current.get(i)).length;
          if (carriedTokens + n > overlapTokens || carriedTokens + n + words.length > tokensPerChunk) {
            break;
          }
          carried.add(0, current.get(i));
          carriedTokens += n;
        }
        current = carried;
        currentTokens = carriedTokens;
      }
      current.add(sentence);
      currentTokens += words.length;
    }
    if (!current.isEmpty()) {
      chunks.add(String.join(" ", current));
    }
    return chunks;
  }

  private static List<String> sentences(String content) {
    BreakIterator iterator = BreakIterator.getSentenceInstance(Locale.ROOT);
    iterator.setText(content);
    List<String> sentences = new ArrayList<>();
    int start = iterator.first();
    for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
      String sentence = content.substring(start, end).strip();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }

  private static String[] words(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
  }
}
