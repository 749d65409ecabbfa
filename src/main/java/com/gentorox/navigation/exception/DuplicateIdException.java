package com.gentorox.navigation.exception;

import java.util.Map;

/** Two navigation nodes resolved to the same id within one build. */
public class DuplicateIdException extends NavigationException {
  private final String id;

  public DuplicateIdException(String id) {
    super(
        NavigationErrorCode.DUPLICATE_ID,
        "Cannot add navigation node with id [" + id + "] because an item with the same id already exists",
        Map.of("id", id));
    this.id = id;
  }

  public String getId() {
    return id;
  }
}
