package com.gentorox.navigation.sources;

import com.gentorox.navigation.dsl.DslCommand;

import java.util.List;

/**
 * One navigation declaration: a named script that evaluates to a top-level command sequence.
 * Modules that build their navigation in code can register an implementation as a Spring bean.
 */
public interface DeclarationSource {

  /** Name used in logs and error messages, e.g. the resource description. */
  String name();

  /** Module that owns the declaration, or null for application code. */
  default String definingModule() {
    return null;
  }

  /**
   * Evaluates the declaration. Called once per reload.
   *
   * @throws com.gentorox.navigation.exception.NavigationException if the script cannot be read or evaluated
   */
  List<DslCommand> commands();
}
