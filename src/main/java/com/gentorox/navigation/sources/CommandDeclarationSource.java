package com.gentorox.navigation.sources;

import com.gentorox.navigation.dsl.DslCommand;

import java.util.List;
import java.util.Objects;

/** Declaration assembled in code from ready-made commands. */
public record CommandDeclarationSource(String name, String definingModule, List<DslCommand> commands)
    implements DeclarationSource {
  public CommandDeclarationSource {
    Objects.requireNonNull(name, "name");
    commands = commands == null ? List.of() : List.copyOf(commands);
  }

  public CommandDeclarationSource(String name, List<DslCommand> commands) {
    this(name, null, commands);
  }
}
