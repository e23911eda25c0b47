package org.eao.jsa.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A stored data product of an observation.
 *
 * <p>Scalar attributes use dotted names such as {@code plane.calibrationLevel} or
 * {@code provenance.runID}.</p>
 *
 * @since 0.1.0
 */
public final class Plane {
  public static final String RUN_ID = "provenance.runID";

  private final String productId;
  private final SortedMap<String, String> attributes = new TreeMap<>();
  private final SortedSet<PlaneUri> inputs = new TreeSet<>();
  private final SortedMap<String, String> custom = new TreeMap<>();
  private final Map<String, Artifact> artifacts = new LinkedHashMap<>();

  public Plane(String productId) {
    this.productId = Objects.requireNonNull(productId, "productId");
  }

  public String productId() {
    return productId;
  }

  public SortedMap<String, String> attributes() {
    return attributes;
  }

  /** Provenance inputs. */
  public SortedSet<PlaneUri> inputs() {
    return inputs;
  }

  /** Derived metrics such as covered area and source count. */
  public SortedMap<String, String> custom() {
    return custom;
  }

  /** Mutable artifact map keyed by URI, in insertion order. */
  public Map<String, Artifact> artifacts() {
    return artifacts;
  }

  /** Run id this plane was produced by, or {@code null}. */
  public String runId() {
    return attributes.get(RUN_ID);
  }

  Plane copy() {
    Plane copy = new Plane(productId);
    copy.attributes.putAll(attributes);
    copy.inputs.addAll(inputs);
    copy.custom.putAll(custom);
    artifacts.forEach((uri, artifact) -> copy.artifacts.put(uri, artifact.copy()));
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Plane other)) {
      return false;
    }
    return productId.equals(other.productId)
        && attributes.equals(other.attributes)
        && inputs.equals(other.inputs)
        && custom.equals(other.custom)
        && artifacts.equals(other.artifacts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(productId, attributes, inputs, custom, artifacts);
  }

  @Override
  public String toString() {
    return "Plane[" + productId + ", artifacts=" + artifacts.keySet() + "]";
  }
}
