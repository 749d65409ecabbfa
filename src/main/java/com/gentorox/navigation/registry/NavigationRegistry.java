package com.gentorox.navigation.registry;

import com.gentorox.navigation.config.NavigationProperties;
import com.gentorox.navigation.discovery.HandlerAutoDiscovery;
import com.gentorox.navigation.discovery.HandlerDescriptor;
import com.gentorox.navigation.discovery.HandlerDirectory;
import com.gentorox.navigation.dsl.DslCommand;
import com.gentorox.navigation.graph.NavigationConditions;
import com.gentorox.navigation.graph.NavigationGraph;
import com.gentorox.navigation.graph.NavigationGraphBuilder;
import com.gentorox.navigation.index.NavigationIndex;
import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationNode;
import com.gentorox.navigation.model.NavigationScope;
import com.gentorox.navigation.sources.DeclarationSource;
import com.gentorox.navigation.sources.DeclarationSourceProvider;
import com.gentorox.navigation.telemetry.LogContext;
import com.gentorox.navigation.telemetry.NavigationTelemetry;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the navigation structure of the application and answers lookups against it.
 *
 * <p>A reload builds a complete new forest from all declaration sources, adds auto-discovered
 * handlers, indexes the result and only then publishes it with a single reference swap. Readers
 * always see one complete snapshot. When a reload fails the previous snapshot stays in place and
 * the failure is rethrown. Reloads are serialized; lookups never block.
 *
 * <p>The active path of a request is kept in request attributes and never touches the snapshot.
 */
public class NavigationRegistry {
  private static final Logger logger = LoggerFactory.getLogger(NavigationRegistry.class);

  public static final String ATTR_ACTIVE_PATH = "navigation.activePath";
  public static final String ATTR_ACTIVE_NODE = "navigation.activeNode";
  public static final String ATTR_ACTIVE_PATH_AUTO = "navigation.activePath.auto";

  private final DeclarationSourceProvider sources;
  private final HandlerDirectory handlerDirectory;
  private final NavigationConditions conditions;
  private final NavigationProperties properties;
  private final NavigationTelemetry telemetry;
  private final HandlerAutoDiscovery autoDiscovery;

  private final AtomicReference<NavigationSnapshot> snapshot = new AtomicReference<>(NavigationSnapshot.EMPTY);

  public NavigationRegistry(DeclarationSourceProvider sources,
                            HandlerDirectory handlerDirectory,
                            NavigationConditions conditions,
                            NavigationProperties properties,
                            NavigationTelemetry telemetry) {
    this.sources = Objects.requireNonNull(sources, "sources");
    this.handlerDirectory = Objects.requireNonNull(handlerDirectory, "handlerDirectory");
    this.conditions = Objects.requireNonNull(conditions, "conditions");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.autoDiscovery = new HandlerAutoDiscovery(
        properties.getInternalModule(), properties.getInternalScope(), properties.getAppScope());
  }

  // ---------- Reload ----------

  /**
   * Rebuilds the whole structure from all declaration sources and the handler directory.
   *
   * @throws com.gentorox.navigation.exception.NavigationException when a declaration is invalid or
   *         an id is declared twice; the previously published structure stays active
   */
  public synchronized void reloadAll() {
    String reloadId = UUID.randomUUID().toString();
    try (LogContext ignored = new LogContext(reloadId)) {
      logger.info("Reloading navigation structure");
      long started = System.nanoTime();
      try {
        Reload result = telemetry.inReloadSpan(reloadId, () -> build(reloadId));
        snapshot.set(result.snapshot());
        telemetry.reloadSucceeded(result.sourceCount(), result.snapshot().index().size());
        logger.info("Navigation reloaded: {} scopes, {} nodes from {} sources in {} ms",
            result.snapshot().scopes().size(), result.snapshot().index().size(), result.sourceCount(),
            (System.nanoTime() - started) / 1_000_000);
      } catch (RuntimeException e) {
        telemetry.reloadFailed();
        logger.error("Navigation reload {} failed, keeping the structure of reload {}",
            reloadId, snapshot.get().reloadId(), e);
        throw e;
      }
    }
  }

  /** Reload triggered by a change to one declaration source. Always rebuilds everything. */
  public void reload(String sourceName) {
    logger.debug("Navigation source [{}] changed", sourceName);
    reloadAll();
  }

  private Reload build(String reloadId) {
    NavigationGraph graph = new NavigationGraph();
    NavigationGraphBuilder builder = new NavigationGraphBuilder(graph, conditions);

    List<DeclarationSource> declarationSources = sources.sources();
    for (DeclarationSource source : declarationSources) {
      logger.debug("Loading navigation declaration [{}]", source.name());
      List<DslCommand> commands = source.commands();
      try {
        builder.build(commands, null, source.definingModule());
      } catch (RuntimeException e) {
        logger.error("Navigation declaration [{}] was rejected: {}", source.name(), e.getMessage());
        throw e;
      }
    }

    List<HandlerDescriptor> handlers = handlerDirectory.handlers();
    if (properties.isAutoDiscovery()) {
      autoDiscovery.discover(graph, NavigationIndex.build(graph.scopes()), handlers);
    } else {
      logger.debug("Auto-discovery is disabled, {} handlers ignored", handlers.size());
    }

    Map<String, String> actions = new LinkedHashMap<>();
    for (HandlerDescriptor h : handlers) {
      actions.put(h.name(), h.defaultAction());
    }
    return new Reload(NavigationSnapshot.of(graph.scopes(), actions, reloadId), declarationSources.size());
  }

  private record Reload(NavigationSnapshot snapshot, int sourceCount) {}

  // ---------- Structure lookups ----------

  /** The currently published snapshot. */
  public NavigationSnapshot snapshot() {
    return snapshot.get();
  }

  public List<NavigationScope> getScopes() {
    return new ArrayList<>(snapshot.get().scopes().values());
  }

  public NavigationScope scopeByName(String name) {
    return snapshot.get().scopes().get(name);
  }

  public NavigationNode nodeForId(String id) {
    return snapshot.get().index().nodeForId(id);
  }

  public NavigationItem nodeForControllerAction(String controller, String action) {
    NavigationItem node = snapshot.get().index().nodeForHandlerAction(controller, action);
    if (logger.isDebugEnabled()) {
      logger.debug("Node for controller/action [{}:{}] is {}", controller, action, node);
    }
    return node;
  }

  /** Default action of {@code controllerName}, or the configured default when it is not a known handler. */
  public String getDefaultControllerAction(String controllerName) {
    String action = controllerName == null ? null : snapshot.get().defaultActions().get(controllerName);
    return action != null ? action : properties.getDefaultAction();
  }

  /**
   * Items from the top of the tree down to the item with {@code id}, without the scope. Empty when
   * no such item exists.
   */
  public List<NavigationNode> nodesForPath(String id) {
    List<NavigationNode> nodes = new ArrayList<>();
    NavigationNode node = nodeForId(id);
    while (node != null && !(node instanceof NavigationScope)) {
      nodes.add(node);
      node = node.getParent();
    }
    Collections.reverse(nodes);
    if (logger.isDebugEnabled()) {
      logger.debug("Found nodesForPath [{}]: {}", id, nodes.stream().map(NavigationNode::getName).toList());
    }
    return nodes;
  }

  /** The item named by the first segment of {@code path}, i.e. the top-level ancestor of that path. */
  public NavigationNode getFirstAncestor(String path) {
    List<String> parts = splitPath(path);
    return parts.isEmpty() ? null : nodeForId(parts.get(0));
  }

  public NavigationNode getFirstNodeOfPath(String path) {
    return getFirstAncestor(path);
  }

  /** Name of the scope holding the node with {@code id}, or null. */
  public String getScopeForId(String id) {
    NavigationNode n = nodeForId(id);
    NavigationScope scope = n == null ? null : n.getScope();
    return scope == null ? null : scope.getName();
  }

  // ---------- Request state ----------

  public void setActivePath(HttpServletRequest request, String path) {
    logger.debug("Setting navigation active path for this request to: {}", path);
    request.setAttribute(ATTR_ACTIVE_PATH, path);
    request.setAttribute(ATTR_ACTIVE_NODE, nodeForId(path));
  }

  /**
   * Sets the active path of the request to the item linked to {@code controllerName} and
   * {@code action}. A missing action means the controller's default action. Nothing changes when
   * the controller is blank or no item is linked to the pair.
   */
  public void setActivePathFromRequest(HttpServletRequest request, String controllerName, String action) {
    if (!StringUtils.hasText(controllerName)) {
      return;
    }
    String resolvedAction = StringUtils.hasText(action) ? action : getDefaultControllerAction(controllerName);
    NavigationItem node = nodeForControllerAction(controllerName, resolvedAction);
    logger.debug("Setting navigation active path from controller/action [{}] and [{}], found node [{}]",
        controllerName, resolvedAction, node);
    if (node != null) {
      setActivePathWasAuto(request, true);
      setActivePath(request, node.getId());
    }
  }

  public String getActivePath(HttpServletRequest request) {
    return (String) request.getAttribute(ATTR_ACTIVE_PATH);
  }

  public NavigationNode getActiveNode(HttpServletRequest request) {
    return (NavigationNode) request.getAttribute(ATTR_ACTIVE_NODE);
  }

  /** True when the active path was derived from the controller and action serving the request. */
  public boolean isActivePathAuto(HttpServletRequest request) {
    return Boolean.TRUE.equals(request.getAttribute(ATTR_ACTIVE_PATH_AUTO));
  }

  public void setActivePathWasAuto(HttpServletRequest request, boolean value) {
    request.setAttribute(ATTR_ACTIVE_PATH_AUTO, value);
  }

  public NavigationNode getFirstActiveNode(HttpServletRequest request) {
    NavigationNode active = getActiveNode(request);
    return active == null ? null : getFirstAncestor(active.getId());
  }

  public String getScopeForActiveNode(HttpServletRequest request) {
    return getScopeForId(getActivePath(request));
  }

  /**
   * Scope of the top-level item of {@code path}, or of the request's active item when no path is
   * given.
   */
  public NavigationScope getPrimaryScopeFor(String path, HttpServletRequest request) {
    NavigationNode first = StringUtils.hasText(path) ? getFirstNodeOfPath(path) : getFirstActiveNode(request);
    return first == null ? null : first.getScope();
  }

  static List<String> splitPath(String path) {
    if (!StringUtils.hasText(path)) {
      return List.of();
    }
    return List.of(path.split(NavigationNode.NODE_PATH_SEPARATOR));
  }
}
