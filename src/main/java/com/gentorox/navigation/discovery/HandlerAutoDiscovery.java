package com.gentorox.navigation.discovery;

import com.gentorox.navigation.graph.NavigationGraph;
import com.gentorox.navigation.graph.NaturalNames;
import com.gentorox.navigation.index.NavigationIndex;
import com.gentorox.navigation.model.LinkTarget;
import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Adds nodes for handlers that no declaration mentions.
 *
 * <p>A handler is skipped entirely as soon as any one of its actions was declared by hand; there is
 * no merging of declared and discovered actions. Otherwise it gets a node linked to its default
 * action, with one child per remaining action. The scope is chosen in this order: the scope the
 * handler asks for, the internal scope for handlers of the internal module, the application scope
 * for handlers without a module, and the module name for everything else.
 */
public class HandlerAutoDiscovery {
  private static final Logger logger = LoggerFactory.getLogger(HandlerAutoDiscovery.class);

  private final String internalModule;
  private final String internalScope;
  private final String appScope;

  public HandlerAutoDiscovery(String internalModule, String internalScope, String appScope) {
    this.internalModule = Objects.requireNonNull(internalModule, "internalModule");
    this.internalScope = Objects.requireNonNull(internalScope, "internalScope");
    this.appScope = Objects.requireNonNull(appScope, "appScope");
  }

  /**
   * Adds nodes for every handler in {@code handlers} that {@code declared} does not link to.
   *
   * @param graph    forest receiving the nodes
   * @param declared index over the declared part of the forest
   * @param handlers known handlers
   * @return the nodes created for handlers, in handler order
   */
  public List<NavigationItem> discover(NavigationGraph graph, NavigationIndex declared,
                                       Collection<HandlerDescriptor> handlers) {
    List<NavigationItem> created = new ArrayList<>();
    for (HandlerDescriptor handler : handlers) {
      String name = handler.name();
      logger.debug("Found actions {} for handler [{}]", handler.actions(), name);

      if (declared.hasHandler(name)) {
        logger.debug("Skipping auto-discovery of handler [{}], manual declarations exist", name);
        continue;
      }

      String scopeName = scopeFor(handler);
      logger.debug("Handler [{}] defined in module [{}] goes to scope [{}]", name, handler.module(), scopeName);

      NavigationScope scope = graph.getOrCreateScope(scopeName);
      NavigationItem handlerNode = graph.addItem(scope, node(name, name, handler.defaultAction()));
      for (String action : handler.actions()) {
        if (action.equals(handler.defaultAction())) continue;
        graph.addItem(handlerNode, node(action, name, action));
      }
      created.add(handlerNode);
    }
    if (!created.isEmpty()) {
      logger.info("Auto-discovered navigation for {} handlers", created.size());
    }
    return created;
  }

  String scopeFor(HandlerDescriptor handler) {
    if (handler.scope() != null && !handler.scope().isBlank()) {
      return handler.scope();
    }
    if (handler.module() == null) {
      return appScope;
    }
    if (handler.module().equals(internalModule)) {
      return internalScope;
    }
    return handler.module();
  }

  private static NavigationItem node(String name, String handler, String action) {
    return NavigationItem.builder(name)
        .titleDefault(NaturalNames.of(name))
        .linkTarget(LinkTarget.forAction(handler, action))
        .build();
  }
}
