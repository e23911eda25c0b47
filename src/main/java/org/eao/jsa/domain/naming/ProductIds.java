package org.eao.jsa.domain.naming;

import java.util.Locale;
import org.eao.jsa.domain.error.IdentifierException;

/**
 * Formats plane product ids for pipeline products.
 *
 * @since 0.1.0
 */
public final class ProductIds {
  private static final String SEPARATOR = "-";

  private ProductIds() {}

  /**
   * Product id of a continuum product, e.g. {@code reduced-850um}.
   *
   * @param product science product token
   * @param filter filter wavelength in microns as recorded in {@code FILTER}
   * @return product id
   * @throws IdentifierException when the filter is missing
   */
  public static String continuum(String product, String filter) throws IdentifierException {
    requireProduct(product);
    if (filter == null || filter.isBlank()) {
      throw new IdentifierException("filter must be supplied to generate a SCUBA-2 productID");
    }
    String trimmed = filter.trim();
    String suffix = switch (trimmed) {
      case "450", "850" -> trimmed + "um";
      default -> trimmed;
    };
    return product + SEPARATOR + suffix;
  }

  /**
   * Product id of a heterodyne product, e.g. {@code cube-230538MHz-250MHzx8192-1}.
   *
   * @param product science product token
   * @param restFrequencyHz rest frequency in Hz
   * @param bandwidthMode {@code BWMODE} header
   * @param subsystemNumber {@code SUBSYSNR} header
   * @return product id
   * @throws IdentifierException when any input is missing
   */
  public static String heterodyne(
      String product, Double restFrequencyHz, String bandwidthMode, String subsystemNumber)
      throws IdentifierException {
    requireProduct(product);
    if (restFrequencyHz == null || !(restFrequencyHz > 0.0)) {
      throw new IdentifierException("restfreq must be supplied to generate a heterodyne productID");
    }
    if (bandwidthMode == null || bandwidthMode.isBlank()) {
      throw new IdentifierException("bwmode must be supplied to generate a heterodyne productID");
    }
    if (subsystemNumber == null || subsystemNumber.isBlank()) {
      throw new IdentifierException("subsysnr must be supplied to generate a heterodyne productID");
    }
    String frequency = String.format(Locale.ROOT, "%.0fMHz", restFrequencyHz * 1.0e-6);
    return String.join(SEPARATOR, product, frequency, bandwidthMode.trim(), subsystemNumber.trim());
  }

  /**
   * Science product named by an external product id: the text before the first hyphen.
   *
   * @param productId {@code PRODID} header
   * @return science product
   */
  public static String scienceProductOf(String productId) {
    int dash = productId.indexOf('-');
    return dash < 0 ? productId : productId.substring(0, dash);
  }

  private static void requireProduct(String product) throws IdentifierException {
    if (product == null || product.isBlank()) {
      throw new IdentifierException("product must be supplied to generate a productID");
    }
  }
}
