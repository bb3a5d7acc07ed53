package com.flamingo.ai.workspace.service.workspace;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Node of the workspace tree view. The root node represents the workspace itself and carries only
 * {@code name}, {@code id}, {@code type} and {@code children}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(
    String name,
    String id,
    String type,
    String artifactId,
    String parentId,
    Integer depth,
    Boolean expanded,
    List<TreeNode> children) {

  static final String ROOT_ID = "-1";
  static final String WORKSPACE_TYPE = "workspace";

  static TreeNode root(String name, List<TreeNode> children) {
    return new TreeNode(name, ROOT_ID, WORKSPACE_TYPE, null, null, null, null, children);
  }
}
