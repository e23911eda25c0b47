package org.eao.jsa.domain.naming;

import java.util.Locale;

/**
 * Content types recorded for archived files.
 *
 * @since 0.1.0
 */
public final class MimeTypes {
  private MimeTypes() {}

  public static String forFileName(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".gz")) {
      lower = lower.substring(0, lower.length() - 3);
    }
    if (lower.endsWith(".fits") || lower.endsWith(".fit")) {
      return "application/fits";
    }
    if (lower.endsWith(".png")) {
      return "image/png";
    }
    if (lower.endsWith(".txt") || lower.endsWith(".log")) {
      return "text/plain";
    }
    return "application/octet-stream";
  }
}
