package com.gentorox.navigation.exception;

import java.util.Map;

/** A navigation declaration uses a form or construct that cannot be turned into a node. */
public class DeclarationException extends NavigationException {
  public DeclarationException(String message, Map<String, ?> context) {
    super(NavigationErrorCode.INVALID_DECLARATION, message, context);
  }

  public DeclarationException(String message, Throwable cause) {
    super(NavigationErrorCode.INVALID_DECLARATION, message, Map.of(), cause);
  }

  private DeclarationException(NavigationErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }

  /** The declaration asks for something reserved but not implemented, such as an overrides block. */
  public static DeclarationException notImplemented(String message, Map<String, ?> context) {
    return new DeclarationException(NavigationErrorCode.UNSUPPORTED_FEATURE, message, context);
  }
}
