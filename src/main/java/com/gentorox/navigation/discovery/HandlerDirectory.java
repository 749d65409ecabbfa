package com.gentorox.navigation.discovery;

import java.util.List;
import java.util.Optional;

/** Enumerates the route handlers of the running application. */
public interface HandlerDirectory {

  /** All known handlers in a stable order. */
  List<HandlerDescriptor> handlers();

  default Optional<HandlerDescriptor> handler(String name) {
    return handlers().stream().filter(h -> h.name().equals(name)).findFirst();
  }
}
