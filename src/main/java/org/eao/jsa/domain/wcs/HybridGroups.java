package org.eao.jsa.domain.wcs;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Groups subsystem records by {@link HybridKey}.
 *
 * @since 0.1.0
 */
public final class HybridGroups {
  private HybridGroups() {}

  /**
   * Merges subsystems into hybrid groups, keeping first-seen order of keys.
   *
   * @param subsystems subsystem records of one plane
   * @return groups keyed by tuning
   */
  public static Map<HybridKey, HybridGroup> merge(Collection<SubsystemRecord> subsystems) {
    Map<HybridKey, HybridGroup> groups = new LinkedHashMap<>();
    for (SubsystemRecord subsystem : subsystems) {
      groups.merge(
          subsystem.hybridKey(),
          HybridGroup.of(subsystem),
          (existing, added) -> existing.including(subsystem));
    }
    return groups;
  }
}
