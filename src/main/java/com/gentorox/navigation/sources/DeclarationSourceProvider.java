package com.gentorox.navigation.sources;

import java.util.List;

/** Supplies the declaration sources of a reload, in the order they are applied. */
@FunctionalInterface
public interface DeclarationSourceProvider {
  List<DeclarationSource> sources();
}
