package org.eao.jsa.domain.header;

/**
 * Source statistics of a catalog-like file.
 *
 * @param sourceCount rows of the first extension, or {@code null}
 * @param areaSqDeg covered area in square degrees, or {@code null}
 * @since 0.1.0
 */
public record CatalogFields(Long sourceCount, Double areaSqDeg) {
  public static final CatalogFields NONE = new CatalogFields(null, null);

  /** Sources per square degree, or {@code null} when not computable. */
  public Double sourceDensity() {
    if (sourceCount == null || areaSqDeg == null || !(areaSqDeg > 0.0)) {
      return null;
    }
    return sourceCount / areaSqDeg;
  }
}
