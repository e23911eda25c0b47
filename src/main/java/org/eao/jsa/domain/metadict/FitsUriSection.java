package org.eao.jsa.domain.metadict;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.eao.jsa.domain.header.WcsInputs;
import org.eao.jsa.domain.model.ObservationUri;

/**
 * Attributes scoped to one artifact ({@code ad:JCMT/<fileId>}) or one of its extensions
 * ({@code ad:JCMT/<fileId>#[n]}).
 *
 * <p>{@code custom} holds free-form per-artifact values; {@code memberTimes} holds the observing
 * interval of every member contributing to a composite science product.</p>
 *
 * @since 0.1.0
 */
public final class FitsUriSection {
  public static final String ARTIFACT_PRODUCT_TYPE = "artifact.productType";
  public static final String PART_PRODUCT_TYPE = "part.productType";

  private final SortedMap<String, String> attributes = new TreeMap<>();
  private final SortedMap<String, String> custom = new TreeMap<>();
  private final SortedMap<ObservationUri, MemberInterval> memberTimes = new TreeMap<>();
  private WcsInputs wcsInputs;

  public SortedMap<String, String> attributes() {
    return attributes;
  }

  public SortedMap<String, String> custom() {
    return custom;
  }

  public SortedMap<ObservationUri, MemberInterval> memberTimes() {
    return memberTimes;
  }

  public WcsInputs wcsInputs() {
    return wcsInputs;
  }

  public void setWcsInputs(WcsInputs wcsInputs) {
    this.wcsInputs = wcsInputs;
  }

  /** Folds another section for the same URI into this one. */
  public void mergeFrom(FitsUriSection other) {
    for (Map.Entry<String, String> entry : other.attributes.entrySet()) {
      attributes.merge(entry.getKey(), entry.getValue(),
          (stored, incoming) -> PlaneKeys.policyOf(entry.getKey()).merge(stored, incoming));
    }
    custom.putAll(other.custom);
    memberTimes.putAll(other.memberTimes);
    if (other.wcsInputs != null) {
      wcsInputs = other.wcsInputs;
    }
  }
}
