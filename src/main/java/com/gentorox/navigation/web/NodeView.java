package com.gentorox.navigation.web;

import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationNode;

import java.util.List;
import java.util.Map;

/**
 * JSON view of a scope or item and its descendants.
 */
public record NodeView(
    String id,
    String name,
    String title,
    String titleMessageCode,
    Map<String, String> link,
    List<NodeView> children
) {

  public static NodeView of(NavigationNode node) {
    List<NodeView> children = node.getChildren().stream().map(NodeView::of).toList();
    if (node instanceof NavigationItem item) {
      return new NodeView(item.getId(), item.getName(), item.getTitleDefault(), item.getTitleMessageCode(),
          item.getLinkTarget().toMap(), children);
    }
    return new NodeView(node.getId(), node.getName(), null, null, Map.of(), children);
  }

  /** Same node without its descendants. */
  public static NodeView shallow(NavigationNode node) {
    NodeView full = of(node);
    return new NodeView(full.id(), full.name(), full.title(), full.titleMessageCode(), full.link(), List.of());
  }
}
