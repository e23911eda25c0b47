package org.eao.jsa.domain.wcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HybridGroupsTest {

  @Test
  void subsystemsWithSameTuningMergeIntoOneGroup() {
    SubsystemRecord low = new SubsystemRecord(
        345.796e9, 4.0, 30517.578125, 345.5, 345.8, 353.5, 353.8, SidebandMode.DSB);
    SubsystemRecord high = new SubsystemRecord(
        345.796e9, 4.0, 30517.578125, 345.7, 346.1, 353.2, 353.6, SidebandMode.DSB);
    SubsystemRecord other = new SubsystemRecord(
        330.588e9, 4.0, 30517.578125, 330.3, 330.9, Double.NaN, Double.NaN, SidebandMode.SSB);

    Map<HybridKey, HybridGroup> groups = HybridGroups.merge(List.of(low, other, high));

    assertEquals(List.of(low.hybridKey(), other.hybridKey()), List.copyOf(groups.keySet()));
    HybridGroup merged = groups.get(low.hybridKey());
    assertEquals(345.5, merged.signalLowerGHz());
    assertEquals(346.1, merged.signalUpperGHz());
    assertEquals(353.2, merged.imageLowerGHz());
    assertEquals(353.8, merged.imageUpperGHz());
    assertTrue(Double.isNaN(groups.get(other.hybridKey()).imageLowerGHz()));
  }

  @Test
  void imageBandOfOneMemberSurvivesMissingImageOfAnother() {
    SubsystemRecord withImage = new SubsystemRecord(
        230.538e9, 6.0, 61035.15625, 230.2, 230.9, 218.2, 218.9, SidebandMode.DSB);
    SubsystemRecord withoutImage = new SubsystemRecord(
        230.538e9, 6.0, 61035.15625, 230.1, 230.6, Double.NaN, Double.NaN, SidebandMode.DSB);

    HybridGroup group = HybridGroups.merge(List.of(withoutImage, withImage)).get(withImage.hybridKey());

    assertEquals(230.1, group.signalLowerGHz());
    assertEquals(218.2, group.imageLowerGHz());
    assertEquals(218.9, group.imageUpperGHz());
  }

  @Test
  void resolvingPowerAndBeamUseMeanFrequency() {
    SubsystemRecord subsystem = new SubsystemRecord(
        230.538e9, 6.0, 61035.15625, 230.0, 231.0, Double.NaN, Double.NaN, SidebandMode.SSB);
    HybridGroup group = HybridGroup.of(subsystem);

    assertEquals(230.5, group.meanFrequencyGHz(), 1e-12);
    assertEquals(230.5e9 / 61035.15625, group.resolvingPower(), 1e-6);
    assertEquals(BeamSize.heterodyne(230.5), group.beamSizeDeg(), 1e-15);
  }

  @Test
  void includingSubsystemOfAnotherTuningIsRejected() {
    HybridGroup group = HybridGroup.of(new SubsystemRecord(
        230.538e9, 6.0, 61035.15625, 230.0, 231.0, Double.NaN, Double.NaN, SidebandMode.SSB));
    SubsystemRecord stranger = new SubsystemRecord(
        220.399e9, 6.0, 61035.15625, 220.0, 221.0, Double.NaN, Double.NaN, SidebandMode.SSB);

    assertThrows(IllegalArgumentException.class, () -> group.including(stranger));
  }

  @Test
  void sidebandModeParsesHeaderSpellings() {
    assertEquals(SidebandMode.TWO_SB, SidebandMode.parse(" 2sb "));
    assertEquals(SidebandMode.DSB, SidebandMode.parse("DSB"));
    assertThrows(IllegalArgumentException.class, () -> SidebandMode.parse("TSB"));
  }
}
