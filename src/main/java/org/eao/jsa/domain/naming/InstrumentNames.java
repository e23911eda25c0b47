package org.eao.jsa.domain.naming;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds unambiguous instrument names.
 *
 * <p>Heterodyne instruments join receiver and spectrometer ({@code HARP-ACSIS}); continuum
 * instruments use the detector alone ({@code SCUBA-2}). Polarimeter and FTS in the beam are
 * prefixed ({@code POL2-SCUBA-2}, {@code FTS2-SCUBA-2}).</p>
 *
 * @since 0.1.0
 */
public final class InstrumentNames {
  private static final Logger log = LoggerFactory.getLogger(InstrumentNames.class);
  private static final Pattern POL = Pattern.compile("POL");
  private static final Pattern FTS2 = Pattern.compile("FTS2");

  public static final Map<String, Set<String>> FRONTENDS = Map.of(
      "ACSIS", Set.of("HARP", "RXA3", "RXA3M", "RXWB", "RXWD2", "UU", "ALAIHI", "AWEOWEO"),
      "DAS", Set.of("RXA", "RXA2", "RXA3", "RXB", "RXB2", "RXB3I", "RXB3", "RXC", "RXC2",
          "RXWCD", "RXWD", "MPIRXE"),
      "AOS-C", Set.of("RXA", "RXA2", "RXB", "RXB2", "RXB3", "RXC", "RXC2"));

  public static final Set<String> CONTINUUM = Set.of("SCUBA-2", "SCUBA");

  private InstrumentNames() {}

  /**
   * Builds the instrument name.
   *
   * @param frontend receiver or detector name, may be {@code null}
   * @param backend spectrometer name, may be {@code null}
   * @param inbeam devices in the optical path, may be {@code null}
   * @return instrument name
   */
  public static String name(String frontend, String backend, String inbeam) {
    String myFrontend = frontend == null ? "UNKNOWN" : frontend.trim().toUpperCase(Locale.ROOT);
    String myBackend = backend == null ? "UNKNOWN" : backend.trim().toUpperCase(Locale.ROOT);
    String myInbeam = inbeam == null ? "" : inbeam.toUpperCase(Locale.ROOT);

    StringBuilder name = new StringBuilder();
    if (POL.matcher(myInbeam).find()) {
      name.append("SCUBA-2".equals(myFrontend) ? "POL2" : "POL").append('-');
    }
    if (FTS2.matcher(myInbeam).find()) {
      name.append("FTS2-");
    }
    name.append(myFrontend);
    Set<String> receivers = FRONTENDS.get(myBackend);
    if (receivers != null) {
      name.append('-').append(myBackend);
      if (!receivers.contains(myFrontend)) {
        log.warn("frontend = {} should be one of {}", myFrontend, new TreeSet<>(receivers));
      }
    } else if (!CONTINUUM.contains(myFrontend)) {
      log.warn("frontend = {} should be one of {}", myFrontend, new TreeSet<>(CONTINUUM));
    }
    return name.toString();
  }

  public static boolean isHeterodyneBackend(String backend) {
    return backend != null && FRONTENDS.containsKey(backend.trim().toUpperCase(Locale.ROOT));
  }
}
