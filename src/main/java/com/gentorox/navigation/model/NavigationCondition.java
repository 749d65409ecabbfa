package com.gentorox.navigation.model;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Decides whether an item is visible or enabled for the request being served. Implementations
 * registered as Spring beans can be referenced by bean name from navigation scripts.
 */
@FunctionalInterface
public interface NavigationCondition {
  NavigationCondition ALWAYS = request -> true;
  NavigationCondition NEVER = request -> false;

  boolean test(HttpServletRequest request);

  static NavigationCondition of(boolean value) {
    return value ? ALWAYS : NEVER;
  }
}
