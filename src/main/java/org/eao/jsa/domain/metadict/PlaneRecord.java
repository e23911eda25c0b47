package org.eao.jsa.domain.metadict;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.eao.jsa.domain.model.PlaneUri;

/**
 * Aggregated facts of one plane within a run.
 *
 * @since 0.1.0
 */
public final class PlaneRecord {
  private final String productId;
  private final SortedMap<String, String> planeDict = new TreeMap<>();
  private final SortedSet<PlaneUri> inputset = new TreeSet<>();
  private final SortedSet<String> fileset = new TreeSet<>();
  private final Map<String, Path> uriDict = new LinkedHashMap<>();
  private final SortedMap<String, String> custom = new TreeMap<>();
  private final Map<String, FitsUriSection> fitsuri = new LinkedHashMap<>();

  public PlaneRecord(String productId) {
    this.productId = Objects.requireNonNull(productId, "productId");
  }

  public String productId() {
    return productId;
  }

  /** Scalar attributes. */
  public SortedMap<String, String> planeDict() {
    return planeDict;
  }

  /** Resolved provenance inputs. */
  public SortedSet<PlaneUri> inputset() {
    return inputset;
  }

  /** Input file ids awaiting resolution. */
  public SortedSet<String> fileset() {
    return fileset;
  }

  /** Artifact URI to local file path, in the order files were read. */
  public Map<String, Path> uriDict() {
    return uriDict;
  }

  /** Aggregator-derived metrics. */
  public SortedMap<String, String> custom() {
    return custom;
  }

  /** Sections keyed by artifact or extension URI. */
  public Map<String, FitsUriSection> fitsuri() {
    return fitsuri;
  }

  /** Returns the section for {@code uri}, creating it on first use. */
  public FitsUriSection section(String uri) {
    return fitsuri.computeIfAbsent(uri, ignored -> new FitsUriSection());
  }

  /**
   * Sets a scalar attribute through its merge policy.
   *
   * @param key attribute name
   * @param value incoming value; {@code null} leaves the attribute unchanged
   */
  public void put(String key, String value) {
    if (value == null) {
      return;
    }
    planeDict.merge(key, value, (stored, incoming) -> PlaneKeys.policyOf(key).merge(stored, incoming));
  }
}
