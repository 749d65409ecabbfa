package com.gentorox.navigation.model;

/**
 * Root-level named group of navigation items, e.g. {@code main}, {@code user} or {@code footer}.
 * A scope never has a parent and never links anywhere; its id is its name.
 */
public class NavigationScope extends NavigationNode {

  public NavigationScope(String name) {
    super(name);
  }

  @Override
  public String getId() {
    return getName();
  }
}
