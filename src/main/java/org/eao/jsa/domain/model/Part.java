package org.eao.jsa.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named part of an artifact, for FITS files one HDU.
 *
 * @since 0.1.0
 */
public final class Part {
  private final String name;
  private String productType;
  private final List<Chunk> chunks = new ArrayList<>();

  public Part(String name, String productType) {
    this.name = Objects.requireNonNull(name, "name");
    this.productType = productType;
  }

  public String name() {
    return name;
  }

  public String productType() {
    return productType;
  }

  public void setProductType(String productType) {
    this.productType = productType;
  }

  /** Mutable chunk list. */
  public List<Chunk> chunks() {
    return chunks;
  }

  Part copy() {
    Part copy = new Part(name, productType);
    copy.chunks.addAll(chunks);
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Part other)) {
      return false;
    }
    return name.equals(other.name)
        && Objects.equals(productType, other.productType)
        && chunks.equals(other.chunks);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, productType, chunks);
  }

  @Override
  public String toString() {
    return "Part[" + name + ", " + productType + ", chunks=" + chunks.size() + "]";
  }
}
