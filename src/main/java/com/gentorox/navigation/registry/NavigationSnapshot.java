package com.gentorox.navigation.registry;

import com.gentorox.navigation.index.NavigationIndex;
import com.gentorox.navigation.model.NavigationScope;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Published navigation state: the scopes in declaration order and the indices built over them.
 * Everything reachable from a snapshot is frozen.
 *
 * @param scopes   scopes by name, in declaration order
 * @param index    lookups over {@code scopes}
 * @param defaultActions default action by handler name, as reported by the handler directory
 * @param reloadId id of the reload that produced this snapshot, null for the initial empty one
 * @param loadedAt when the snapshot was published
 */
public record NavigationSnapshot(Map<String, NavigationScope> scopes, NavigationIndex index,
                                 Map<String, String> defaultActions, String reloadId, Instant loadedAt) {

  public static final NavigationSnapshot EMPTY =
      new NavigationSnapshot(Map.of(), NavigationIndex.EMPTY, Map.of(), null, Instant.EPOCH);

  /** Freezes {@code scopes}, indexes them and wraps both. */
  public static NavigationSnapshot of(List<NavigationScope> scopes, Map<String, String> defaultActions,
                                      String reloadId) {
    Map<String, NavigationScope> byName = new LinkedHashMap<>();
    for (NavigationScope scope : scopes) {
      scope.freeze();
      byName.put(scope.getName(), scope);
    }
    return new NavigationSnapshot(Collections.unmodifiableMap(byName), NavigationIndex.build(byName.values()),
        Map.copyOf(defaultActions), reloadId, Instant.now());
  }
}
