package org.eao.jsa.domain.naming;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between subsystem observation ids ({@code OBSIDSS}) and observation ids.
 *
 * @since 0.1.0
 */
public final class ObsIds {
  private static final Pattern OBSIDSS =
      Pattern.compile("^(scuba2|acsis|DAS|AOSC|scuba)_(\\d+)_(\\d{8})[tT](\\d{6})_\\d+$");
  private static final Pattern MEMBER_KEY =
      Pattern.compile("(scuba2|acsis|DAS|AOSC|scuba)_\\d+_(\\d{8}[tT]\\d{6})_\\d+");
  private static final Map<String, String> IRREGULAR =
      Map.of("scuba2_18_20120703T075007_850", "scuba2_00018_20120703T075008");

  private ObsIds() {}

  /**
   * Archive search pattern for the observation owning a subsystem id: instrument prefix and
   * timestamp with a wildcard between, since observation numbers are zero-padded inconsistently.
   *
   * @param obsidss subsystem observation id from an {@code OBSn} header
   * @return SQL {@code LIKE} pattern, empty when the id is not recognized
   */
  public static Optional<String> memberSearchPattern(String obsidss) {
    Matcher m = MEMBER_KEY.matcher(obsidss);
    if (!m.find()) {
      return Optional.empty();
    }
    return Optional.of(m.group(1) + "%" + m.group(2));
  }

  /**
   * Guesses the observation id for a subsystem id using per-instrument padding rules.
   *
   * @param obsidss subsystem observation id
   * @return observation id
   * @throws IllegalArgumentException when the id cannot be converted
   */
  public static String obsidOf(String obsidss) {
    String irregular = IRREGULAR.get(obsidss);
    if (irregular != null) {
      return irregular;
    }
    Matcher m = OBSIDSS.matcher(obsidss);
    if (!m.matches()) {
      throw new IllegalArgumentException("format of obsidss not recognised: " + obsidss);
    }
    String inst = m.group(1);
    int obs = Integer.parseInt(m.group(2));
    String date = m.group(3);
    String time = m.group(4);
    boolean unpadded = switch (inst) {
      case "scuba2" -> date.compareTo("20091004") < 0;
      case "DAS" -> false;
      case "acsis" -> date.compareTo("20061001") >= 0 && date.compareTo("20070521") <= 0;
      default -> throw new IllegalArgumentException("do not know how to format obsid for: " + obsidss);
    };
    String number = unpadded ? Integer.toString(obs) : String.format(Locale.ROOT, "%05d", obs);
    return inst + "_" + number + "_" + date + "T" + time;
  }
}
