package org.eao.jsa.domain.naming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Checks and collects the keywords recorded for an instrument configuration.
 *
 * @since 0.1.0
 */
public final class InstrumentKeywords {
  public static final String INBEAM = "inbeam";
  public static final String SIDEBAND = "sideband";
  public static final String SIDEBAND_FILTER = "sideband_filter";
  public static final String SWITCHING_MODE = "switching_mode";
  public static final String SCAN_PATTERN = "x_scan_pat";

  private static final Pattern SKIPPED_INBEAM = Pattern.compile("POL|FTS|SHUTTER");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Set<String> SIDEBANDS = Set.of("LSB", "USB");
  private static final Set<String> SWITCHING = Set.of("CHOP", "FREQSW", "NONE", "PSSW");

  private static final Map<String, Permitted> PERMITTED = Map.of(
      "ACSIS", new Permitted(Set.of("WAVEPLATE"), SIDEBANDS, Set.of("DSB", "SSB", "2SB"), SWITCHING),
      "DAS", new Permitted(Set.of("ROVER"), SIDEBANDS, Set.of("DSB", "SSB", "UNKNOWN"), SWITCHING),
      "AOS-C", new Permitted(Set.of(), SIDEBANDS, Set.of("DSB", "SSB", "UNKNOWN"), SWITCHING),
      "SCUBA-2", new Permitted(Set.of("BLACKBODY"), Set.of(), Set.of(), Set.of("NONE", "SELF", "SPIN")));

  private InstrumentKeywords() {}

  /**
   * Validates candidate keywords and returns them in key order.
   *
   * @param strictness checking mode
   * @param frontend receiver name
   * @param backend spectrometer name, or {@code SCUBA-2}
   * @param candidates keyword name to raw value; see the constants of this class
   * @return keyword values, upper case, sorted by keyword name
   * @throws IllegalArgumentException when a keyword is missing or not permitted
   */
  public static List<String> keywords(
      KeywordStrictness strictness, String frontend, String backend, Map<String, String> candidates) {
    String myBackend = backend == null ? "" : backend.trim().toUpperCase(Locale.ROOT);
    String myFrontend = frontend == null ? "" : frontend.trim().toUpperCase(Locale.ROOT);
    Permitted permitted = PERMITTED.get(myBackend);
    if (permitted == null) {
      throw new IllegalArgumentException(
          "instrument keywords do not recognize '" + backend + "' as a permitted backend");
    }
    Map<String, String> keywords = new TreeMap<>(candidates);
    keywords.values().removeIf(value -> value == null);

    if (!permitted.sidebands().isEmpty()) {
      checkSideband(strictness, myBackend, myFrontend, keywords, permitted);
    } else {
      if (keywords.containsKey(SIDEBAND)) {
        throw new IllegalArgumentException("sideband is not permitted for " + backend);
      }
      if (keywords.containsKey(SIDEBAND_FILTER)) {
        throw new IllegalArgumentException("sideband_filter is not permitted for " + backend);
      }
    }

    String switching = keywords.get(SWITCHING_MODE);
    if (switching == null) {
      if (strictness == KeywordStrictness.RAW) {
        throw new IllegalArgumentException("switching_mode is not defined");
      }
    } else {
      String normalized = switching.trim().toUpperCase(Locale.ROOT);
      if (normalized.equals("FREQ")) {
        normalized = "FREQSW";
      }
      if (!permitted.switchingModes().contains(normalized)) {
        throw new IllegalArgumentException("switching_mode " + normalized
            + " is not in the list permitted for " + myBackend + ": " + sorted(permitted.switchingModes()));
      }
      keywords.put(SWITCHING_MODE, normalized);
    }

    List<String> result = new ArrayList<>();
    for (Map.Entry<String, String> entry : keywords.entrySet()) {
      if (entry.getKey().equals(INBEAM)) {
        String inbeam = entry.getValue().trim().toUpperCase(Locale.ROOT);
        if (inbeam.isEmpty()) {
          continue;
        }
        for (String item : WHITESPACE.split(inbeam)) {
          if (SKIPPED_INBEAM.matcher(item).find()) {
            continue;
          }
          if (!permitted.inbeam().contains(item)) {
            throw new IllegalArgumentException("inbeam entry '" + item + "' is not permitted for "
                + myBackend + ": " + sorted(permitted.inbeam()));
          }
          result.add(item);
        }
      } else {
        result.add(entry.getValue().trim().toUpperCase(Locale.ROOT));
      }
    }
    return result;
  }

  private static void checkSideband(
      KeywordStrictness strictness,
      String backend,
      String frontend,
      Map<String, String> keywords,
      Permitted permitted) {
    String sideband = keywords.get(SIDEBAND);
    if (sideband == null) {
      if (strictness == KeywordStrictness.RAW) {
        throw new IllegalArgumentException("with strictness " + strictness + " backend " + backend
            + " frontend " + frontend + " sideband is not defined");
      }
    } else if (!permitted.sidebands().contains(sideband.trim().toUpperCase(Locale.ROOT))) {
      throw new IllegalArgumentException("sideband " + sideband
          + " is not in the list permitted for " + backend + ": " + sorted(permitted.sidebands()));
    }

    String filter = keywords.get(SIDEBAND_FILTER);
    if (filter == null) {
      if (strictness != KeywordStrictness.EXTERNAL) {
        throw new IllegalArgumentException("sideband_filter is not defined");
      }
      return;
    }
    String normalized = filter.trim().toUpperCase(Locale.ROOT);
    if (normalized.isEmpty() && !frontend.equals("RXB3")) {
      keywords.put(SIDEBAND_FILTER, "DSB");
    } else if (normalized.equals("UNKNOWN") && (backend.equals("DAS") || backend.equals("AOS-C"))) {
      keywords.remove(SIDEBAND_FILTER);
    } else if (!permitted.sidebandFilters().contains(normalized)) {
      throw new IllegalArgumentException("sideband_filter " + normalized
          + " is not in the list permitted for " + backend + ": " + sorted(permitted.sidebandFilters()));
    }
  }

  private static List<String> sorted(Set<String> values) {
    List<String> list = new ArrayList<>(values);
    Collections.sort(list);
    return list;
  }

  private record Permitted(
      Set<String> inbeam, Set<String> sidebands, Set<String> sidebandFilters, Set<String> switchingModes) {}
}
