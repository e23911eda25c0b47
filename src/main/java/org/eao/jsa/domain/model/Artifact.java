package org.eao.jsa.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored file, identified by its archive URI such as {@code ad:JCMT/<fileId>}.
 *
 * @since 0.1.0
 */
public final class Artifact {
  private final String uri;
  private String productType;
  private String contentType;
  private final Map<String, Part> parts = new LinkedHashMap<>();

  public Artifact(String uri, String productType) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.productType = productType;
  }

  public String uri() {
    return uri;
  }

  /** File id: the last path element of the URI. */
  public String fileId() {
    int slash = uri.lastIndexOf('/');
    return slash < 0 ? uri : uri.substring(slash + 1);
  }

  public String productType() {
    return productType;
  }

  public void setProductType(String productType) {
    this.productType = productType;
  }

  public String contentType() {
    return contentType;
  }

  public void setContentType(String contentType) {
    this.contentType = contentType;
  }

  /** Mutable part map keyed by part name, in insertion order. */
  public Map<String, Part> parts() {
    return parts;
  }

  Artifact copy() {
    Artifact copy = new Artifact(uri, productType);
    copy.contentType = contentType;
    parts.forEach((name, part) -> copy.parts.put(name, part.copy()));
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Artifact other)) {
      return false;
    }
    return uri.equals(other.uri)
        && Objects.equals(productType, other.productType)
        && Objects.equals(contentType, other.contentType)
        && parts.equals(other.parts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri, productType, contentType, parts);
  }

  @Override
  public String toString() {
    return "Artifact[" + uri + ", " + productType + ", parts=" + parts.keySet() + "]";
  }
}
