package com.gentorox.navigation.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One statement of a navigation declaration script, as produced by {@link DeclarationEvaluator}.
 *
 * <p>The variant set is closed:
 * <ul>
 *   <li>{@link BlockCommand} - named container without arguments (a scope or a branch)</li>
 *   <li>{@link NamedArgsBlockCommand} - branch with keyword arguments and descendants</li>
 *   <li>{@link NamedArgsCallCommand} - leaf with keyword arguments</li>
 *   <li>{@link SetValueCommand} - property assignment, never valid in a navigation declaration</li>
 *   <li>{@link PlainCallCommand} - positional call, never valid in a navigation declaration</li>
 * </ul>
 */
public sealed interface DslCommand
    permits DslCommand.BlockCommand,
        DslCommand.NamedArgsBlockCommand,
        DslCommand.NamedArgsCallCommand,
        DslCommand.SetValueCommand,
        DslCommand.PlainCallCommand {

  String name();

  record BlockCommand(String name, List<DslCommand> children) implements DslCommand {
    public BlockCommand {
      children = children == null ? List.of() : List.copyOf(children);
    }
  }

  record NamedArgsBlockCommand(String name, Map<String, Object> arguments, List<DslCommand> children)
      implements DslCommand {
    public NamedArgsBlockCommand {
      arguments = Arguments.copy(arguments);
      children = children == null ? List.of() : List.copyOf(children);
    }
  }

  record NamedArgsCallCommand(String name, Map<String, Object> arguments) implements DslCommand {
    public NamedArgsCallCommand {
      arguments = Arguments.copy(arguments);
    }
  }

  record SetValueCommand(String name, Object value) implements DslCommand {}

  record PlainCallCommand(String name, List<Object> arguments) implements DslCommand {
    public PlainCallCommand {
      arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
    }
  }
}
