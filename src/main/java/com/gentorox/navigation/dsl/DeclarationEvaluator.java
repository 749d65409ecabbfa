package com.gentorox.navigation.dsl;

import com.gentorox.navigation.dsl.DslCommand.BlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsBlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsCallCommand;
import com.gentorox.navigation.dsl.DslCommand.PlainCallCommand;
import com.gentorox.navigation.dsl.DslCommand.SetValueCommand;
import com.gentorox.navigation.exception.DeclarationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a YAML navigation script into an ordered list of {@link DslCommand}s.
 *
 * <p>Each key of a mapping is a command name, and the shape of its value selects the command:
 * <ul>
 *   <li>a mapping holding only mappings (or nothing) is a {@link BlockCommand}</li>
 *   <li>a mapping holding only scalars or lists is a {@link NamedArgsCallCommand}</li>
 *   <li>a mapping holding both is a {@link NamedArgsBlockCommand}; scalar and list entries are the
 *       arguments, mapping entries are the children</li>
 *   <li>a scalar is a {@link SetValueCommand}</li>
 *   <li>a list or an empty value is a {@link PlainCallCommand}</li>
 * </ul>
 * The script is read as a node tree rather than as maps, so a key repeated within one mapping
 * yields one command per occurrence, in declaration order. A repeated scope reopens it; a
 * repeated item is left for the graph builder to reject. A repeated argument of one item is an
 * error here.
 */
public class DeclarationEvaluator {
  private static final Logger logger = LoggerFactory.getLogger(DeclarationEvaluator.class);

  private final LoaderOptions loaderOptions = new LoaderOptions();

  /**
   * Parses a script from the given stream. The stream is read fully but not closed.
   *
   * @param in         the script content, UTF-8
   * @param sourceName name used in error messages
   * @return the top-level command sequence; empty for an empty document
   */
  public List<DslCommand> evaluate(InputStream in, String sourceName) throws IOException {
    Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
    Node document;
    try {
      document = new Yaml(loaderOptions).compose(reader);
    } catch (YAMLException e) {
      throw new DeclarationException("Navigation script [" + sourceName + "] is not valid YAML: " + e.getMessage(), e);
    }
    if (document == null) {
      logger.debug("Navigation script [{}] is empty", sourceName);
      return List.of();
    }
    if (!(document instanceof MappingNode root)) {
      throw new DeclarationException(
          "Navigation script [" + sourceName + "] must be a mapping of scope names, found " + document.getNodeId(),
          Map.of("source", sourceName));
    }
    List<DslCommand> commands;
    try {
      commands = new Evaluation(loaderOptions, sourceName).block(root);
    } catch (YAMLException e) {
      throw new DeclarationException("Navigation script [" + sourceName + "] has an invalid value: " + e.getMessage(), e);
    }
    logger.debug("Evaluated navigation script [{}] into {} top-level commands", sourceName, commands.size());
    return commands;
  }

  /** State of one script evaluation; scalar values are built with SnakeYAML's safe constructor. */
  private static final class Evaluation extends SafeConstructor {
    private final String sourceName;

    Evaluation(LoaderOptions options, String sourceName) {
      super(options);
      this.sourceName = sourceName;
    }

    List<DslCommand> block(MappingNode mapping) {
      List<DslCommand> commands = new ArrayList<>(mapping.getValue().size());
      for (NodeTuple entry : mapping.getValue()) {
        commands.add(command(key(entry), entry.getValueNode()));
      }
      return commands;
    }

    private DslCommand command(String name, Node valueNode) {
      if (!(valueNode instanceof MappingNode map)) {
        Object value = constructObject(valueNode);
        if (value == null) {
          return new PlainCallCommand(name, List.of());
        }
        if (value instanceof List<?> list) {
          return new PlainCallCommand(name, new ArrayList<>(list));
        }
        return new SetValueCommand(name, value);
      }

      Map<String, Object> arguments = new LinkedHashMap<>();
      List<NodeTuple> children = new ArrayList<>();
      for (NodeTuple entry : map.getValue()) {
        if (entry.getValueNode() instanceof MappingNode) {
          children.add(entry);
          continue;
        }
        String argument = key(entry);
        if (arguments.containsKey(argument)) {
          throw new DeclarationException(
              "Navigation script [" + sourceName + "] gives argument [" + argument + "] twice to [" + name + "]",
              Map.of("source", sourceName, "command", name, "argument", argument));
        }
        arguments.put(argument, constructObject(entry.getValueNode()));
      }

      List<DslCommand> childCommands = new ArrayList<>(children.size());
      for (NodeTuple child : children) {
        childCommands.add(command(key(child), child.getValueNode()));
      }
      if (arguments.isEmpty()) {
        return new BlockCommand(name, childCommands);
      }
      if (childCommands.isEmpty()) {
        return new NamedArgsCallCommand(name, arguments);
      }
      return new NamedArgsBlockCommand(name, arguments, childCommands);
    }

    private String key(NodeTuple entry) {
      if (entry.getKeyNode() instanceof ScalarNode scalar) {
        return scalar.getValue();
      }
      throw new DeclarationException(
          "Navigation script [" + sourceName + "] uses a " + entry.getKeyNode().getNodeId() + " as a name",
          Map.of("source", sourceName));
    }
  }
}
