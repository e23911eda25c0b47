package org.eao.jsa.domain.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Archive reference to an observation, {@code caom:<collection>/<observationID>}.
 *
 * @since 0.1.0
 */
public record ObservationUri(String collection, String observationId)
    implements Comparable<ObservationUri> {
  private static final Pattern URI = Pattern.compile("^caom:([^\\s/]+)/([^\\s/]+)$");

  public ObservationUri {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(observationId, "observationId");
  }

  /**
   * Parses {@code caom:<collection>/<observationID>}.
   *
   * @param text URI text
   * @return parsed reference
   * @throws IllegalArgumentException when the text is not an observation URI
   */
  public static ObservationUri parse(String text) {
    Matcher m = URI.matcher(text == null ? "" : text.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("not an observation URI: " + text);
    }
    return new ObservationUri(m.group(1), m.group(2));
  }

  public String uri() {
    return "caom:" + collection + "/" + observationId;
  }

  @Override
  public int compareTo(ObservationUri other) {
    return uri().compareTo(other.uri());
  }

  @Override
  public String toString() {
    return uri();
  }
}
