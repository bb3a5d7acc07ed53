package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-based chunker that balances chunk sizes by cutting at the sentence, paragraph, heading or
 * list boundary closest to the target size instead of at the first line that overflows.
 *
 * <p>Lines after the chosen cut are carried into the next chunk together with up to {@code
 * overlap} characters of trailing lines from the emitted chunk.
 */
public class SmartChunker extends AbstractChunker {

  public static final String PROVIDER = "smart";

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？]\\s*$");
  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s.*");
  private static final Pattern LIST_ITEM = Pattern.compile("^[-*+]\\s.*");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

  public SmartChunker(WorkspaceConfig.Chunking config) {
    super(config);
  }

  @Override
  public String getProvider() {
    return PROVIDER;
  }

  @Override
  protected List<String> split(String content) {
    String[] lines = clean(content).split(Pattern.quote(separator), -1);
    List<String> texts = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentSize = 0;

    for (String line : lines) {
      if (currentSize + line.length() > chunkSize && !current.isEmpty()) {
        int cut = bestSplitPoint(current);
        List<String> emitted = new ArrayList<>(current.subList(0, cut));
        List<String> rest = new ArrayList<>(current.subList(cut, current.size()));
        texts.add(String.join(separator, emitted));

        int restSize = size(rest);
        List<String> overlap = overlapLines(emitted, chunkSize - restSize - line.length());
        current = new ArrayList<>(overlap);
        current.addAll(rest);
        currentSize = size(current);
      }
      current.add(line);
      currentSize += line.length();
    }
    if (!current.isEmpty()) {
      texts.add(String.join(separator, current));
    }

    List<String> chunks = new ArrayList<>();
    for (String text : texts) {
      String cleaned = clean(text);
      if (!cleaned.isBlank()) {
        chunks.add(cleaned);
      }
    }
    return chunks;
  }

  private int bestSplitPoint(List<String> lines) {
    int size = 0;
    int best = 0;
    int minDiff = Integer.MAX_VALUE;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (size + line.length() > chunkSize) {
        int diff = Math.abs(size - chunkSize);
        if (diff < minDiff) {
          best = i;
        }
        break;
      }
      size += line.length();
      if (isGoodSplitPoint(line)) {
        int diff = Math.abs(size - chunkSize);
        if (diff < minDiff) {
          minDiff = diff;
          best = i + 1;
        }
      }
    }
    if (best == 0) {
      best = lines.size();
    }
    return Math.max(1, best);
  }

  private List<String> overlapLines(List<String> lines, int budget) {
    int limit = Math.min(chunkOverlap, budget);
    List<String> overlap = new ArrayList<>();
    int size = 0;
    for (int i = lines.size() - 1; i >= 0 && limit > 0; i--) {
      String line = lines.get(i);
      if (size + line.length() > limit) {
        break;
      }
      overlap.add(0, line);
      size += line.length();
    }
    return overlap;
  }

  static boolean isGoodSplitPoint(String line) {
    String stripped = line.strip();
    return stripped.isEmpty()
        || SENTENCE_END.matcher(stripped).find()
        || MARKDOWN_HEADING.matcher(stripped).matches()
        || (LIST_ITEM.matcher(stripped).matches() && !stripped.endsWith(","));
  }

  private static int size(List<String> lines) {
    int size = 0;
    for (String line : lines) {
      size += line.length();
    }
    return size;
  }

  /** Collapses runs of blank lines and trims trailing whitespace and surrounding blank lines. */
  static String clean(String text) {
    String collapsed = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
    List<String> lines = new ArrayList<>();
    for (String line : collapsed.split("\n", -1)) {
      lines.add(line.stripTrailing());
    }
    while (!lines.isEmpty() && lines.get(0).isBlank()) {
      lines.remove(0);
    }
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
      lines.remove(lines.size() - 1);
    }
    List<String> result = new ArrayList<>();
    boolean previousEmpty = false;
    for (String line : lines) {
      if (!line.isBlank()) {
        result.add(line);
        previousEmpty = false;
      } else if (!previousEmpty) {
        result.add("");
        previousEmpty = true;
      }
    }
    return String.join("\n", result);
  }
}
