package com.gentorox.navigation.graph;

import org.springframework.util.StringUtils;

/**
 * Turns identifiers into display phrases: {@code orderHistory} becomes {@code Order History},
 * {@code user_profile} becomes {@code User Profile}.
 */
public final class NaturalNames {
  private NaturalNames() {}

  public static String of(String name) {
    if (!StringUtils.hasText(name)) {
      return name;
    }
    StringBuilder sb = new StringBuilder(name.length() + 8);
    char prev = 0;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '_' || c == '-' || c == ' ') {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ') sb.append(' ');
        prev = ' ';
        continue;
      }
      boolean boundary = Character.isUpperCase(c)
          && prev != 0
          && prev != ' '
          && (Character.isLowerCase(prev) || Character.isDigit(prev) || nextIsLower(name, i) && Character.isUpperCase(prev));
      if (boundary) sb.append(' ');
      sb.append(sb.length() == 0 || sb.charAt(sb.length() - 1) == ' ' ? Character.toUpperCase(c) : c);
      prev = c;
    }
    return sb.toString().trim();
  }

  private static boolean nextIsLower(String s, int i) {
    return i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
  }
}
