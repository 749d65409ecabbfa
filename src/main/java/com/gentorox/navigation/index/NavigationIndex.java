package com.gentorox.navigation.index;

import com.gentorox.navigation.model.LinkTarget;
import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationNode;
import com.gentorox.navigation.model.NavigationScope;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Flat lookup tables over a navigation forest: every scope and item by id, and every item linked
 * to a handler by {@code handler:action}.
 *
 * <p>Instances are immutable. When two items link to the same handler action the one visited last
 * in depth-first order wins.
 */
public final class NavigationIndex {
  public static final NavigationIndex EMPTY = new NavigationIndex(Map.of(), Map.of());

  private final Map<String, NavigationNode> nodesById;
  private final Map<String, NavigationItem> nodesByHandlerAction;

  private NavigationIndex(Map<String, NavigationNode> nodesById, Map<String, NavigationItem> nodesByHandlerAction) {
    this.nodesById = nodesById;
    this.nodesByHandlerAction = nodesByHandlerAction;
  }

  /** Walks every scope depth-first and indexes what it finds. */
  public static NavigationIndex build(Collection<NavigationScope> scopes) {
    Map<String, NavigationNode> byId = new HashMap<>();
    Map<String, NavigationItem> byHandlerAction = new HashMap<>();
    for (NavigationScope scope : scopes) {
      byId.put(scope.getId(), scope);
      for (NavigationItem item : scope.getChildren()) {
        indexItem(item, byId, byHandlerAction);
      }
    }
    return new NavigationIndex(Collections.unmodifiableMap(byId), Collections.unmodifiableMap(byHandlerAction));
  }

  private static void indexItem(NavigationItem item, Map<String, NavigationNode> byId,
                                Map<String, NavigationItem> byHandlerAction) {
    byId.put(item.getId(), item);
    LinkTarget link = item.getLinkTarget();
    if (link.hasController()) {
      byHandlerAction.put(link.handlerActionKey(), item);
    }
    for (NavigationItem child : item.getChildren()) {
      indexItem(child, byId, byHandlerAction);
    }
  }

  public NavigationNode nodeForId(String id) {
    return id == null ? null : nodesById.get(id);
  }

  public NavigationItem nodeForHandlerAction(String handler, String action) {
    if (handler == null) return null;
    return nodesByHandlerAction.get(LinkTarget.key(handler, action));
  }

  /** True when at least one item links to some action of {@code handler}. */
  public boolean hasHandler(String handler) {
    String prefix = handler + ":";
    for (String key : nodesByHandlerAction.keySet()) {
      if (key.startsWith(prefix)) return true;
    }
    return false;
  }

  public Map<String, NavigationNode> nodesById() {
    return nodesById;
  }

  public Map<String, NavigationItem> nodesByHandlerAction() {
    return nodesByHandlerAction;
  }

  public int size() {
    return nodesById.size();
  }
}
