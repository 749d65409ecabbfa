package com.gentorox.navigation.graph;

import com.gentorox.navigation.dsl.DslCommand;
import com.gentorox.navigation.dsl.DslCommand.BlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsBlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsCallCommand;
import com.gentorox.navigation.dsl.DslCommand.PlainCallCommand;
import com.gentorox.navigation.dsl.DslCommand.SetValueCommand;
import com.gentorox.navigation.exception.DeclarationException;
import com.gentorox.navigation.model.LinkTarget;
import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interprets declaration commands into scopes and items of a {@link NavigationGraph}.
 *
 * <p>Rules:
 * <ul>
 *   <li>At the top level only blocks are allowed, and each one declares (or reopens) a scope. A
 *       scope block may not carry arguments.</li>
 *   <li>Below a scope, a block becomes an item and its children are built under it; a named
 *       argument call becomes a leaf item.</li>
 *   <li>Property assignments and positional calls are rejected wherever they appear.</li>
 *   <li>A block named {@code overrides} is reserved and rejected at every depth.</li>
 * </ul>
 */
public class NavigationGraphBuilder {
  private static final Logger logger = LoggerFactory.getLogger(NavigationGraphBuilder.class);

  static final String OVERRIDES_BLOCK = "overrides";

  private final NavigationGraph graph;
  private final NavigationConditions conditions;

  public NavigationGraphBuilder(NavigationGraph graph, NavigationConditions conditions) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.conditions = Objects.requireNonNull(conditions, "conditions");
  }

  public NavigationGraph graph() {
    return graph;
  }

  /**
   * Builds {@code commands} under {@code parent}.
   *
   * @param commands       commands in declaration order
   * @param parent         node receiving the items, or null for the top level
   * @param definingModule module that owns the declaration, may be null
   * @throws DeclarationException when a command is not legal where it appears
   * @throws com.gentorox.navigation.exception.DuplicateIdException when an id is declared twice
   */
  public void build(List<DslCommand> commands, NavigationNode parent, String definingModule) {
    if (logger.isDebugEnabled()) {
      logger.debug("Building {} navigation commands in parent [{}], defined by module [{}]",
          commands.size(), parent == null ? null : parent.getId(), definingModule);
    }
    for (DslCommand c : commands) {
      if (c instanceof BlockCommand block) {
        buildBlock(block.name(), Map.of(), block.children(), parent, definingModule);
      } else if (c instanceof NamedArgsBlockCommand block) {
        buildBlock(block.name(), block.arguments(), block.children(), parent, definingModule);
      } else if (c instanceof NamedArgsCallCommand call) {
        if (parent == null) {
          throw new DeclarationException(
              "Named argument calls are only supported inside a scope. The declaration tried to call ["
                  + call.name() + "](" + call.arguments() + ")",
              context(call.name(), definingModule));
        }
        addItemFromArgs(call.name(), call.arguments(), parent);
      } else if (c instanceof SetValueCommand set) {
        throw new DeclarationException(
            "Property setting and simple method calls are not supported in navigation declarations. The declaration tried to set ["
                + set.name() + "] to " + set.value(),
            context(set.name(), definingModule));
      } else if (c instanceof PlainCallCommand call) {
        throw new DeclarationException(
            "Property setting and simple method calls are not supported in navigation declarations. The declaration tried to call ["
                + call.name() + "] with args " + call.arguments(),
            context(call.name(), definingModule));
      } else {
        throw new DeclarationException(
            "Unsupported navigation command type " + (c == null ? "null" : c.getClass().getName()),
            context(c == null ? null : c.name(), definingModule));
      }
    }
  }

  private void buildBlock(String name, Map<String, Object> arguments, List<DslCommand> children,
                          NavigationNode parent, String definingModule) {
    if (OVERRIDES_BLOCK.equals(name)) {
      throw DeclarationException.notImplemented(
          parent == null
              ? "The 'overrides' block is not yet implemented"
              : "The 'overrides' block is not valid except at the scope level, and is not yet implemented",
          context(name, definingModule));
    }
    NavigationNode next;
    if (parent == null) {
      if (!arguments.isEmpty()) {
        throw new DeclarationException(
            "A root scope cannot take arguments, arguments are for nodes only. Scope [" + name + "] was given " + arguments,
            context(name, definingModule));
      }
      next = graph.getOrCreateScope(name);
    } else {
      next = addItemFromArgs(name, arguments, parent);
    }
    build(children, next, definingModule);
  }

  NavigationItem addItemFromArgs(String name, Map<String, Object> args, NavigationNode parent) {
    LinkTarget link = LinkTarget.fromArguments(args);
    if (!link.hasController() && link.action() != null && parent instanceof NavigationItem parentItem) {
      // controller is inherited from the parent's link
      link = link.withController(parentItem.getLinkTarget().controller());
    }

    Object titleText = args.get("titleText");
    Object title = args.get("title");
    NavigationItem item = NavigationItem.builder(name)
        .titleDefault(titleText != null ? String.valueOf(titleText) : NaturalNames.of(name))
        .titleMessageCode(title != null ? String.valueOf(title) : null)
        .linkTarget(link)
        .visible(conditions.resolve(name, "visible", args.get("visible")))
        .enabled(conditions.resolve(name, "enabled", args.get("enabled")))
        .build();
    return graph.addItem(parent, item);
  }

  private static Map<String, Object> context(String command, String definingModule) {
    return definingModule == null
        ? Map.of("command", String.valueOf(command))
        : Map.of("command", String.valueOf(command), "module", definingModule);
  }
}
