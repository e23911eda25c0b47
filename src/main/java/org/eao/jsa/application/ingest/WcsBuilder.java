package org.eao.jsa.application.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.eao.jsa.domain.error.GeometryException;
import org.eao.jsa.domain.header.WcsInputs;
import org.eao.jsa.domain.metadict.FitsUriSection;
import org.eao.jsa.domain.metadict.MemberInterval;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.metadict.PlaneRecord;
import org.eao.jsa.domain.model.ObservationUri;
import org.eao.jsa.domain.wcs.BeamSize;
import org.eao.jsa.domain.wcs.ChunkWcs;
import org.eao.jsa.domain.wcs.CoordRange;
import org.eao.jsa.domain.wcs.Footprint;
import org.eao.jsa.domain.wcs.FootprintRepair;
import org.eao.jsa.domain.wcs.HybridGroup;
import org.eao.jsa.domain.wcs.HybridGroups;
import org.eao.jsa.domain.wcs.HybridKey;
import org.eao.jsa.domain.wcs.Mjd;
import org.eao.jsa.domain.wcs.RepairKind;
import org.eao.jsa.domain.wcs.SidebandMode;
import org.eao.jsa.domain.wcs.SpatialWcs;
import org.eao.jsa.domain.wcs.SpectralWcs;
import org.eao.jsa.domain.wcs.SubsystemRecord;
import org.eao.jsa.domain.wcs.TemporalWcs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes spatial, spectral and temporal WCS for every file of a plane.
 * <p><strong>Why:</strong> Heterodyne subsystems observed together as a hybrid share one spectral
 * description, so the axes can only be computed once all files of the plane are known.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Repair degenerate or self-intersecting footprints using the beam size.</li>
 *   <li>Merge hybrid subsystems by (rest frequency, IF frequency, channel spacing).</li>
 *   <li>Build a time sample per member for composite products.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class WcsBuilder {
  private static final Logger log = LoggerFactory.getLogger(WcsBuilder.class);
  private static final String SPECSYS = "TOPOCENT";

  /**
   * @param plane aggregated plane
   * @return WCS per artifact URI; files without WCS inputs are absent
   * @throws GeometryException when a footprint cannot be repaired
   */
  public Map<String, FileWcs> build(PlaneRecord plane) throws GeometryException {
    List<SubsystemRecord> subsystems = new ArrayList<>();
    for (FitsUriSection section : plane.fitsuri().values()) {
      WcsInputs inputs = section.wcsInputs();
      if (inputs != null && inputs.subsystem() != null) {
        subsystems.add(inputs.subsystem());
      }
    }
    Map<HybridKey, HybridGroup> groups = HybridGroups.merge(subsystems);
    String species = plane.planeDict().get(PlaneKeys.ENERGY_SPECIES);
    String transition = plane.planeDict().get(PlaneKeys.ENERGY_TRANSITION);

    Map<String, FileWcs> result = new LinkedHashMap<>();
    for (Map.Entry<String, FitsUriSection> entry : plane.fitsuri().entrySet()) {
      FitsUriSection section = entry.getValue();
      WcsInputs inputs = section.wcsInputs();
      if (inputs == null) {
        continue;
      }
      HybridGroup group = inputs.subsystem() == null ? null : groups.get(inputs.subsystem().hybridKey());
      ChunkWcs chunk = new ChunkWcs(
          position(entry.getKey(), inputs, group),
          energy(inputs, group, species, transition),
          time(inputs));
      result.put(entry.getKey(), new FileWcs(chunk, memberTime(section.memberTimes())));
    }
    return result;
  }

  private static SpatialWcs position(String uri, WcsInputs inputs, HybridGroup group)
      throws GeometryException {
    if (inputs.corners() == null) {
      return null;
    }
    double beam;
    if (group != null) {
      beam = group.beamSizeDeg();
    } else if (inputs.wavelengthMicrons() != null) {
      beam = BeamSize.continuum(inputs.wavelengthMicrons());
    } else {
      beam = Double.NaN;
    }
    Footprint footprint;
    try {
      footprint = FootprintRepair.repair(inputs.corners(), beam);
    } catch (GeometryException ex) {
      throw new GeometryException(uri + ": " + ex.getMessage(), ex);
    }
    if (footprint.repair() != null && footprint.repair() != RepairKind.NONE) {
      log.info("{}: footprint repaired as {}", uri, footprint.repair());
    }
    return SpatialWcs.of(footprint);
  }

  private static SpectralWcs energy(WcsInputs inputs, HybridGroup group, String species,
      String transition) {
    SubsystemRecord subsystem = inputs.subsystem();
    if (group != null) {
      List<CoordRange> samples = new ArrayList<>();
      samples.add(CoordRange.between(group.signalLowerGHz(), group.signalUpperGHz()));
      if (subsystem.sidebandMode() == SidebandMode.DSB
          && !Double.isNaN(group.imageLowerGHz()) && !Double.isNaN(group.imageUpperGHz())) {
        samples.add(CoordRange.between(group.imageLowerGHz(), group.imageUpperGHz()));
      }
      samples.sort(Comparator.comparingDouble(CoordRange::start));
      return new SpectralWcs("FREQ", "GHz", SPECSYS, subsystem.restFrequencyHz(), samples,
          group.resolvingPower(), null, species, transition);
    }
    Double wavelength = inputs.wavelengthMicrons();
    Double bandwidth = inputs.bandwidthMicrons();
    if (wavelength == null || bandwidth == null || !(bandwidth > 0.0)) {
      return null;
    }
    double lambda = wavelength * 1.0e-6;
    double width = bandwidth * 1.0e-6;
    return new SpectralWcs(
        "WAVE",
        "m",
        SPECSYS,
        null,
        List.of(CoordRange.between(lambda - width / 2.0, lambda + width / 2.0)),
        Math.abs(lambda / width),
        "SCUBA-2-" + formatMicrons(wavelength) + "um",
        null,
        null);
  }

  private static String formatMicrons(double microns) {
    return microns == Math.rint(microns) ? Long.toString((long) microns) : Double.toString(microns);
  }

  private static TemporalWcs time(WcsInputs inputs) {
    if (inputs.start() == null || inputs.end() == null) {
      return null;
    }
    double start = Mjd.of(inputs.start());
    double end = Mjd.of(inputs.end());
    return new TemporalWcs(List.of(CoordRange.between(start, end)), Mjd.seconds(start, end));
  }

  private static TemporalWcs memberTime(SortedMap<ObservationUri, MemberInterval> members) {
    if (members.size() < 2) {
      return null;
    }
    List<CoordRange> samples = new ArrayList<>();
    double exposure = 0.0;
    for (MemberInterval interval : members.values()) {
      samples.add(new CoordRange(interval.startMjd(), interval.endMjd()));
      exposure += Mjd.seconds(interval.startMjd(), interval.endMjd());
    }
    samples.sort(Comparator.comparingDouble(CoordRange::start));
    return new TemporalWcs(samples, exposure);
  }
}
