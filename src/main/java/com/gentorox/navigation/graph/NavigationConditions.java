package com.gentorox.navigation.graph;

import com.gentorox.navigation.exception.DeclarationException;
import com.gentorox.navigation.model.NavigationCondition;

import java.util.Map;

/**
 * Resolves the {@code visible} and {@code enabled} declaration values: booleans (or their string
 * forms) become constant conditions, any other string names a registered condition.
 */
public class NavigationConditions {
  private final Map<String, NavigationCondition> named;

  public NavigationConditions(Map<String, NavigationCondition> named) {
    this.named = named == null ? Map.of() : Map.copyOf(named);
  }

  public static NavigationConditions none() {
    return new NavigationConditions(Map.of());
  }

  /** Returns null when no value was declared so the item falls back to its default. */
  public NavigationCondition resolve(String nodeName, String key, Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof NavigationCondition c) {
      return c;
    }
    if (value instanceof Boolean b) {
      return NavigationCondition.of(b);
    }
    String s = String.valueOf(value).trim();
    if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
      return NavigationCondition.of(Boolean.parseBoolean(s));
    }
    NavigationCondition c = named.get(s);
    if (c == null) {
      throw new DeclarationException(
          "Navigation node [" + nodeName + "] refers to unknown " + key + " condition [" + s + "]",
          Map.of("node", nodeName, "condition", s));
    }
    return c;
  }
}
