package com.gentorox.navigation.graph;

import com.gentorox.navigation.exception.DuplicateIdException;
import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationNode;
import com.gentorox.navigation.model.NavigationScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Forest under construction during one reload. Scopes keep the order in which they were first
 * declared. Not thread-safe; a graph belongs to the reload that created it.
 */
public class NavigationGraph {
  private static final Logger logger = LoggerFactory.getLogger(NavigationGraph.class);

  private final Map<String, NavigationScope> scopes = new LinkedHashMap<>();
  private final Set<String> ids = new HashSet<>();

  /** Returns the scope with the given name, creating and registering it on first use. */
  public NavigationScope getOrCreateScope(String name) {
    NavigationScope scope = scopes.get(name);
    if (scope == null) {
      if (ids.contains(name)) {
        throw new DuplicateIdException(name);
      }
      logger.debug("Creating scope [{}]", name);
      scope = new NavigationScope(name);
      scopes.put(name, scope);
      ids.add(scope.getId());
    }
    return scope;
  }

  /**
   * Adds {@code item} under {@code parent}. This is the only place nodes enter the forest, so it is
   * where id uniqueness is enforced.
   *
   * @throws DuplicateIdException if a scope or node with the same id already exists
   */
  public NavigationItem addItem(NavigationNode parent, NavigationItem item) {
    Objects.requireNonNull(parent, "parent");
    String id = NavigationItem.idFor(parent, item.getName());
    if (!ids.add(id)) {
      throw new DuplicateIdException(id);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Adding node [{}] to parent [{}] with link {}", id, parent.getId(), item.getLinkTarget().toMap());
    }
    parent.add(item);
    return item;
  }

  public NavigationScope scope(String name) {
    return scopes.get(name);
  }

  public List<NavigationScope> scopes() {
    return new ArrayList<>(scopes.values());
  }

  public boolean containsId(String id) {
    return ids.contains(id);
  }

  public int size() {
    return ids.size();
  }
}
