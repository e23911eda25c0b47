package org.eao.jsa.domain.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Archive reference to a plane, {@code caom:<collection>/<observationID>/<productID>}.
 *
 * @since 0.1.0
 */
public record PlaneUri(String collection, String observationId, String productId)
    implements Comparable<PlaneUri> {
  private static final Pattern URI = Pattern.compile("^caom:([^\\s/]+)/([^\\s/]+)/([^\\s/]+)$");

  public PlaneUri {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(observationId, "observationId");
    Objects.requireNonNull(productId, "productId");
  }

  /**
   * Parses {@code caom:<collection>/<observationID>/<productID>}.
   *
   * @param text URI text
   * @return parsed reference
   * @throws IllegalArgumentException when the text is not a plane URI
   */
  public static PlaneUri parse(String text) {
    Matcher m = URI.matcher(text == null ? "" : text.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("not a plane URI: " + text);
    }
    return new PlaneUri(m.group(1), m.group(2), m.group(3));
  }

  public ObservationUri observationUri() {
    return new ObservationUri(collection, observationId);
  }

  public String uri() {
    return "caom:" + collection + "/" + observationId + "/" + productId;
  }

  @Override
  public int compareTo(PlaneUri other) {
    return uri().compareTo(other.uri());
  }

  @Override
  public String toString() {
    return uri();
  }
}
