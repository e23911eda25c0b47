package org.eao.jsa.domain.naming;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Families of processed products. The {@code PRODUCT} header of a pipeline file names one of the
 * family's tokens; the plane is keyed by the family's science product.
 *
 * @since 0.1.0
 */
public enum ScienceProduct {
  REDUCED("reduced", 2, "0=science,1=noise,auxiliary", "JCMT_STANDARD_PIPELINE"),
  CUBE("cube", 1, "0=science,1=noise,auxiliary", "JCMT_STANDARD_PIPELINE"),
  HEALPIX("healpix", 2, "0=science,1=noise,auxiliary", "JCMT_LEGACY_PIPELINE"),
  PEAK_CAT("peak-cat", 3, "0=catalog,auxiliary", "JCMT_LEGACY_PIPELINE"),
  EXTENT_CAT("extent-cat", 3, "0=catalog,auxiliary", "JCMT_LEGACY_PIPELINE"),
  POINT_CAT("point-cat", 3, "0=catalog,auxiliary", "JCMT_LEGACY_PIPELINE");

  private static final String PREVIEW_TYPES = "0=preview,1=noise,auxiliary";

  private static final Map<String, ScienceProduct> BY_PRODUCT = Map.ofEntries(
      Map.entry("reduced", REDUCED),
      Map.entry("rsp", REDUCED),
      Map.entry("rimg", REDUCED),
      Map.entry("cube", CUBE),
      Map.entry("healpix", HEALPIX),
      Map.entry("hpxrsp", HEALPIX),
      Map.entry("hpxrimg", HEALPIX),
      Map.entry("peak-cat", PEAK_CAT),
      Map.entry("extent-cat", EXTENT_CAT),
      Map.entry("point-cat", POINT_CAT));

  private final String token;
  private final int pipelineCalibrationLevel;
  private final String defaultProductTypes;
  private final String pipelineProject;

  ScienceProduct(
      String token, int pipelineCalibrationLevel, String defaultProductTypes, String pipelineProject) {
    this.token = token;
    this.pipelineCalibrationLevel = pipelineCalibrationLevel;
    this.defaultProductTypes = defaultProductTypes;
    this.pipelineProject = pipelineProject;
  }

  /**
   * Looks up the family of a pipeline {@code PRODUCT} token.
   *
   * @param product header value
   * @return family, empty when the token is not a pipeline product
   */
  public static Optional<ScienceProduct> forProduct(String product) {
    if (product == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_PRODUCT.get(product.trim().toLowerCase(Locale.ROOT)));
  }

  /** Token used as the plane's science product. */
  public String token() {
    return token;
  }

  /** Calibration level of the main product when produced by the observatory pipelines. */
  public int pipelineCalibrationLevel() {
    return pipelineCalibrationLevel;
  }

  /** Project name recorded for files produced by the observatory pipelines. */
  public String pipelineProject() {
    return pipelineProject;
  }

  /**
   * Default {@code PRODTYPE} for a product token of this family.
   *
   * @param product header value
   * @return product-type declaration
   */
  public String defaultProductTypes(String product) {
    String normalized = product.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals(token)) {
      return defaultProductTypes;
    }
    return switch (normalized) {
      case "rsp", "rimg", "hpxrsp", "hpxrimg" -> PREVIEW_TYPES;
      default -> defaultProductTypes;
    };
  }

  public boolean isCatalog() {
    return this == PEAK_CAT || this == EXTENT_CAT || this == POINT_CAT;
  }
}
