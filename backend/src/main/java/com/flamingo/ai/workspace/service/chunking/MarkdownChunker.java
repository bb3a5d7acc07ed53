package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;

/**
 * Splits markdown content into one chunk per section delimited by level 1-3 headings.
 *
 * <p>Each chunk's content is prefixed with the heading path it sits under. Deeper headings stay
 * inside the enclosing section's text. Sections without body text are skipped.
 */
public class MarkdownChunker extends AbstractChunker {

  public static final String PROVIDER = "markdown";

  private static final int MAX_SPLIT_LEVEL = 3;
  private static final Parser PARSER = Parser.builder().build();

  public MarkdownChunker(WorkspaceConfig.Chunking config) {
    super(config);
  }

  @Override
  public String getProvider() {
    return PROVIDER;
  }

  @Override
  public List<Chunk> chunk(Artifact artifact) {
    String content = artifact.getContent();
    if (content == null || content.isBlank()) {
      return List.of();
    }
    List<Section> sections = sections(content);
    List<Chunk> chunks = new ArrayList<>(sections.size());
    for (int i = 0; i < sections.size(); i++) {
      Section section = sections.get(i);
      chunks.add(buildChunk(artifact, i, section.render(), section.body().length()));
    }
    return chunks;
  }

  @Override
  protected List<String> split(String content) {
    return sections(content).stream().map(Section::render).toList();
  }

  private List<Section> sections(String content) {
    SectionVisitor visitor = new SectionVisitor();
    PARSER.parse(content).accept(visitor);
    return visitor.finish();
  }

  /** Body text of a section and the heading path above it. */
  record Section(String h1, String h2, String h3, String body) {

    String render() {
      return "Header#1 "
          + nullToEmpty(h1)
          + "\nHeader#2: "
          + nullToEmpty(h2)
          + "\nHeader#3: "
          + nullToEmpty(h3)
          + "\nContent: \n\n  "
          + body;
    }

    private static String nullToEmpty(String value) {
      return value == null ? "" : value;
    }
  }

  private static final class SectionVisitor extends AbstractVisitor {

    private final String[] headers = new String[MAX_SPLIT_LEVEL + 1];
    private final StringBuilder body = new StringBuilder();
    private final List<Section> sections = new ArrayList<>();

    @Override
    public void visit(Heading heading) {
      String title = extractText(heading);
      if (heading.getLevel() > MAX_SPLIT_LEVEL) {
        body.append(title).append("\n\n");
        return;
      }
      flush();
      headers[heading.getLevel()] = title;
      for (int level = heading.getLevel() + 1; level <= MAX_SPLIT_LEVEL; level++) {
        headers[level] = null;
      }
    }

    @Override
    public void visit(Paragraph paragraph) {
      String text = extractText(paragraph);
      if (!text.isBlank()) {
        body.append(text).append("\n\n");
      }
    }

    @Override
    public void visit(BlockQuote blockQuote) {
      String text = extractText(blockQuote);
      if (!text.isBlank()) {
        body.append("> ").append(text).append("\n\n");
      }
    }

    @Override
    public void visit(BulletList list) {
      appendListItems(list, false);
    }

    @Override
    public void visit(OrderedList list) {
      appendListItems(list, true);
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      String info = codeBlock.getInfo() != null ? codeBlock.getInfo() : "";
      body.append("```").append(info).append("\n").append(codeBlock.getLiteral()).append("```\n\n");
    }

    @Override
    public void visit(IndentedCodeBlock codeBlock) {
      body.append("```\n").append(codeBlock.getLiteral()).append("```\n\n");
    }

    List<Section> finish() {
      flush();
      return sections;
    }

    private void flush() {
      String text = body.toString().strip();
      if (!text.isEmpty()) {
        sections.add(new Section(headers[1], headers[2], headers[3], text));
      }
      body.setLength(0);
    }

    private void appendListItems(Node list, boolean ordered) {
      Node item = list.getFirstChild();
      int number = 1;
      while (item != null) {
        String text = extractText(item);
        if (!text.isBlank()) {
          body.append(ordered ? (number++) + ". " : "- ").append(text).append("\n");
        }
        item = item.getNext();
      }
      body.append("\n");
    }

    private static String extractText(Node node) {
      StringBuilder sb = new StringBuilder();
      collectText(node, sb);
      return sb.toString().trim();
    }

    private static void collectText(Node node, StringBuilder sb) {
      if (node instanceof Text text) {
        sb.append(text.getLiteral());
      } else if (node instanceof Code code) {
        sb.append(code.getLiteral());
      } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
        sb.append(" ");
      } else {
        Node child = node.getFirstChild();
        while (child != null) {
          collectText(child, sb);
          child = child.getNext();
        }
      }
    }
  }
}
