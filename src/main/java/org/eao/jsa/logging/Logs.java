package org.eao.jsa.logging;

/**
 * Helpers that keep header values echoed into log lines short and single-line.
 *
 * <p>FITS comments and history cards can be long; log lines should not be.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int DEFAULT_MAX_CHARS = 80;

  private Logs() {
    // Utility
  }

  /**
   * Renders a header value for logging with the default length limit.
   *
   * @param value header value, may be {@code null}
   * @return printable, truncated text
   */
  public static String value(Object value) {
    return truncate(value == null ? null : value.toString(), DEFAULT_MAX_CHARS);
  }

  /**
   * Replaces control characters and truncates to {@code maxChars}, noting the original length.
   *
   * @param value text to render; {@code null} yields {@code "<null>"}
   * @param maxChars maximum characters kept; must be positive
   * @return sanitized text
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    StringBuilder sb = new StringBuilder(Math.min(value.length(), maxChars) + 24);
    int limit = Math.min(value.length(), maxChars);
    for (int i = 0; i < limit; i++) {
      char c = value.charAt(i);
      sb.append(Character.isISOControl(c) ? ' ' : c);
    }
    if (value.length() > maxChars) {
      sb.append("... (truncated, ").append(maxChars).append(" of ").append(value.length()).append(')');
    }
    return sb.toString();
  }
}
