package com.flamingo.ai.workspace.domain.enums;

/** Closed set of content kinds an artifact can hold. */
public enum ArtifactType {
  TEXT,
  CODE,
  MARKDOWN,
  HTML,
  SVG,
  JSON,
  CSV,
  TABLE,
  CHART,
  DIAGRAM,
  MCP_CALL,
  TOOL_CALL,
  LLM_OUTPUT,
  WEB_PAGES,
  DIR,
  CUSTOM,
  NOVEL,
  CHUNK;

  /**
   * File extension used when the raw content of an artifact of this type is written to storage.
   *
   * @return extension without the leading dot
   */
  public String contentExtension() {
    return switch (this) {
      case MARKDOWN -> "md";
      case HTML, WEB_PAGES -> "html";
      case SVG -> "svg";
      case JSON, MCP_CALL, TOOL_CALL, CHART, DIAGRAM -> "json";
      case CSV, TABLE -> "csv";
      case CODE -> "code";
      default -> "txt";
    };
  }

  /**
   * Whether artifacts of this type carry text that can be split into chunks.
   *
   * @return true for textual types
   */
  public boolean supportsChunking() {
    return switch (this) {
      case DIR, CHUNK -> false;
      default -> true;
    };
  }
}
