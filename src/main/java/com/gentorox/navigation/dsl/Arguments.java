package com.gentorox.navigation.dsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Helpers for keyword-argument maps carried by commands. Insertion order is preserved. */
final class Arguments {
  private Arguments() {}

  static Map<String, Object> copy(Map<String, Object> in) {
    if (in == null || in.isEmpty()) return Collections.emptyMap();
    return Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }
}
