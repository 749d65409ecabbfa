package com.gentorox.navigation.discovery;

import java.util.List;
import java.util.Objects;

/**
 * What the navigation core knows about one route handler.
 *
 * @param name          handler name used in link targets, e.g. {@code orders}
 * @param module        name of the module that owns the handler, or null for application code
 * @param scope         scope requested by the handler itself, or null
 * @param defaultAction action served when a request names the handler only
 * @param actions       every action the handler serves, in discovery order
 */
public record HandlerDescriptor(String name, String module, String scope, String defaultAction, List<String> actions) {
  public HandlerDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(defaultAction, "defaultAction");
    actions = actions == null ? List.of() : List.copyOf(actions);
  }
}
