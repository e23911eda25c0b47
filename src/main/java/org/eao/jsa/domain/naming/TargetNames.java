package org.eao.jsa.domain.naming;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Target names are upper case, trimmed, with internal whitespace collapsed to single spaces.
 *
 * @since 0.1.0
 */
public final class TargetNames {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TargetNames() {}

  public static String normalize(String objectName) {
    return WHITESPACE.matcher(objectName.strip().toUpperCase(Locale.ROOT)).replaceAll(" ");
  }
}
