package org.eao.jsa.domain.wcs;

import java.util.Locale;

/**
 * Receiver sideband configuration, from the {@code SB_MODE} header.
 *
 * @since 0.1.0
 */
public enum SidebandMode {
  /** Double sideband: signal and image both reach the detector. */
  DSB,
  /** Single sideband. */
  SSB,
  /** Sideband separating. */
  TWO_SB;

  /**
   * Parses a header value.
   *
   * @param raw header text such as {@code DSB} or {@code 2SB}
   * @return parsed mode
   * @throws IllegalArgumentException for unknown values
   */
  public static SidebandMode parse(String raw) {
    String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "DSB" -> DSB;
      case "SSB" -> SSB;
      case "2SB" -> TWO_SB;
      default -> throw new IllegalArgumentException("unknown sideband mode: " + raw);
    };
  }
}
