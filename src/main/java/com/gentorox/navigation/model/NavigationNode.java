package com.gentorox.navigation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Common supertype of {@link NavigationScope} and {@link NavigationItem}: a named, addressable
 * entry in the navigation forest owning an ordered list of child items.
 *
 * <p>Nodes are assembled while a reload is in progress and frozen before they are published; after
 * {@link #freeze()} any attempt to add children fails.
 */
public abstract class NavigationNode {
  /** Separator between the names that make up a node id. */
  public static final String NODE_PATH_SEPARATOR = "/";

  private final String name;
  private final List<NavigationItem> children = new ArrayList<>();
  private NavigationNode parent;
  private boolean frozen;

  protected NavigationNode(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  /** Globally unique path of this node. */
  public abstract String getId();

  public NavigationNode getParent() {
    return parent;
  }

  public List<NavigationItem> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /** The scope at the root of the tree holding this node. */
  public NavigationScope getScope() {
    NavigationNode n = this;
    while (n.parent != null) {
      n = n.parent;
    }
    return n instanceof NavigationScope scope ? scope : null;
  }

  /**
   * Appends a child and makes this node its parent. Id uniqueness is the caller's concern; this
   * method only rejects reparenting and additions after the node was frozen.
   */
  public void add(NavigationItem child) {
    Objects.requireNonNull(child, "child");
    if (frozen) {
      throw new IllegalStateException("Navigation node [" + getId() + "] is frozen and cannot accept children");
    }
    ((NavigationNode) child).attachTo(this);
    children.add(child);
  }

  private void attachTo(NavigationNode newParent) {
    if (parent != null) {
      throw new IllegalStateException("Navigation node [" + name + "] already belongs to [" + parent.getId() + "]");
    }
    parent = newParent;
  }

  /** Freezes this node and all its descendants. */
  public void freeze() {
    frozen = true;
    for (NavigationItem child : children) {
      child.freeze();
    }
  }

  public boolean isFrozen() {
    return frozen;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + getId() + "]";
  }
}
