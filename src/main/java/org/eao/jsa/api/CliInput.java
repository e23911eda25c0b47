package org.eao.jsa.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments of {@code jsa-ingest} split into recognised switches and the remaining
 * command word and {@code key=value} settings.
 *
 * <p>Switches may appear anywhere. Unknown switches are kept so the CLI can reject them.</p>
 */
public final class CliInput {
  /** Switches understood by the dispatcher and the commands. */
  public enum Switch {
    HELP,
    VERBOSE,
    DRY_RUN,
    ALLOW_REMOVE
  }

  private static final Map<String, Switch> ALIASES = Map.of(
      "--help", Switch.HELP,
      "-h", Switch.HELP,
      "help", Switch.HELP,
      "--verbose", Switch.VERBOSE,
      "-v", Switch.VERBOSE,
      "--debug", Switch.VERBOSE,
      "--dry-run", Switch.DRY_RUN,
      "-n", Switch.DRY_RUN,
      "--allow-remove", Switch.ALLOW_REMOVE);

  private final List<String> remainder;
  private final Set<Switch> switches;
  private final List<String> unknownSwitches;

  private CliInput(List<String> remainder, Set<Switch> switches, List<String> unknownSwitches) {
    this.remainder = remainder;
    this.switches = switches;
    this.unknownSwitches = unknownSwitches;
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw CLI arguments, may be {@code null}
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> remainder = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    List<String> unknown = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        Switch known = ALIASES.get(arg.toLowerCase(Locale.ROOT));
        if (known != null) {
          switches.add(known);
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          unknown.add(arg);
        } else {
          remainder.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(remainder), Set.copyOf(switches), List.copyOf(unknown));
  }

  /** Command word and {@code key=value} settings, in order. */
  public String[] keyValueArgs() {
    return remainder.toArray(String[]::new);
  }

  public boolean has(Switch value) {
    return switches.contains(value);
  }

  public boolean help() {
    return has(Switch.HELP);
  }

  public boolean verbose() {
    return has(Switch.VERBOSE);
  }

  /** Switches that look like flags but are not understood, as typed. */
  public List<String> unknownSwitches() {
    return unknownSwitches;
  }
}
