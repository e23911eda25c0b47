package org.eao.jsa.application.ingest;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.eao.jsa.domain.error.ValidationException;
import org.eao.jsa.domain.header.CatalogFields;
import org.eao.jsa.domain.header.EnvironmentFields;
import org.eao.jsa.domain.header.FileHeader;
import org.eao.jsa.domain.header.HeaderFields;
import org.eao.jsa.domain.header.HeaderValues;
import org.eao.jsa.domain.header.InstrumentFields;
import org.eao.jsa.domain.header.MembershipFields;
import org.eao.jsa.domain.header.ProductFields;
import org.eao.jsa.domain.header.ProposalFields;
import org.eao.jsa.domain.header.ProvenanceFields;
import org.eao.jsa.domain.header.TargetFields;
import org.eao.jsa.domain.header.WcsInputs;
import org.eao.jsa.domain.naming.ArchiveCollections;
import org.eao.jsa.domain.naming.InstrumentKeywords;
import org.eao.jsa.domain.naming.InstrumentNames;
import org.eao.jsa.domain.naming.KeywordStrictness;
import org.eao.jsa.domain.naming.ObsTypes;
import org.eao.jsa.domain.naming.ProductTypes;
import org.eao.jsa.domain.naming.ScienceProduct;
import org.eao.jsa.domain.naming.TargetNames;
import org.eao.jsa.domain.wcs.Corners;
import org.eao.jsa.domain.wcs.SidebandMode;
import org.eao.jsa.domain.wcs.SubsystemRecord;
import org.eao.jsa.domain.wcs.Vec2;
import org.eao.jsa.logging.Logs;
import org.eao.jsa.validation.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads the FITS header keywords of one file into typed {@link HeaderFields}.
 * <p><strong>Why:</strong> Every later stage works on validated values; header problems must be reported
 * per file before anything is aggregated.</p>
 * <p><strong>Role:</strong> First stage of the ingestion pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Check mandatory and conditionally mandatory keywords.</li>
 *   <li>Check enumerated values against the permitted vocabularies.</li>
 *   <li>Clamp environment readings into their physical ranges, warning when a value moves.</li>
 * </ul>
 * <p>All problems found in a header are collected and reported together in a single
 * {@link ValidationException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless after construction; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class HeaderExtractor {
  private static final Logger log = LoggerFactory.getLogger(HeaderExtractor.class);

  /** Speed of light in m/s as used for the JCMT wavelength conversions. */
  public static final double SPEED_OF_LIGHT = 2.99792485e8;

  private static final Set<String> SURVEYS = Set.of("CLS", "DDS", "GBS", "JPS", "NGS", "SASSY", "SLS");
  private static final Set<String> BACKENDS = Set.of("ACSIS", "DAS", "AOS-C", "SCUBA-2");
  private static final Set<String> TARGET_TYPES = Set.of("FIELD", "OBJECT");
  private static final Set<String> CALIBRATION_LEVELS = Set.of("calibrated", "product");
  private static final Set<String> DATA_PRODUCT_TYPES = Set.of("image", "spectrum", "cube", "catalog");
  private static final Pattern JAC_RUN = Pattern.compile("^jac-0*(\\d+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern HEX_RUN = Pattern.compile("^0x([0-9a-f]+)$", Pattern.CASE_INSENSITIVE);
  private static final String NO_LINE = "No Line";

  private final String collection;

  /**
   * @param collection configured archive collection; must be one of {@link ArchiveCollections#ALL}
   */
  public HeaderExtractor(String collection) {
    this.collection = ArchiveCollections.requireKnown(collection);
  }

  /**
   * Extracts and validates the header of one file.
   *
   * @param header raw header maps of the file
   * @return typed header values
   * @throws ValidationException listing every problem found in the header
   */
  public HeaderFields extract(FileHeader header) throws ValidationException {
    Objects.requireNonNull(header, "header");
    Problems problems = new Problems();
    HeaderValues h = header.values();

    problems.require(h, "BITPIX");
    String instream = problems.read(() -> h.upper("INSTREAM"));
    if (instream == null) {
      problems.add("INSTREAM is mandatory");
    } else if (!ArchiveCollections.acceptsInstream(collection, instream)) {
      problems.add("INSTREAM = " + instream + " is not permitted for collection " + collection);
    }
    boolean external = ArchiveCollections.isExternal(instream);

    String asnType = problems.read(() -> h.lower("ASN_TYPE"));
    if (asnType == null) {
      asnType = "custom";
    }
    String obsid = problems.read(() -> h.string("OBSID"));
    String asnId = problems.read(() -> h.string("ASN_ID"));
    if ("obs".equals(asnType)) {
      if (obsid == null) {
        problems.add("OBSID is mandatory when ASN_TYPE = obs");
      }
      if (instream != null && !ArchiveCollections.JCMT.equals(instream)) {
        problems.add("ASN_TYPE = obs is only permitted for INSTREAM = JCMT");
      }
    } else if (asnId == null) {
      problems.add("ASN_ID is mandatory when ASN_TYPE = " + asnType);
    }

    InstrumentFields instrument = instrument(h, external, problems);
    ProductFields product = product(h, header, instrument, external, problems);
    HeaderFields fields = new HeaderFields(
        header.fileId(),
        header.fileName(),
        instream == null ? "" : instream,
        asnType,
        obsid,
        asnId,
        proposal(h, problems),
        membership(h, problems),
        environment(h, header.fileId(), problems),
        instrument,
        target(h, instrument, problems),
        product,
        provenance(h, instream, product, problems),
        wcs(h, problems),
        catalog(header, problems));

    if (!problems.isEmpty()) {
      throw new ValidationException(header.fileId(), problems.list());
    }
    return fields;
  }

  private ProposalFields proposal(HeaderValues h, Problems problems) {
    String survey = problems.read(() -> h.upper("SURVEY"));
    if (survey != null && !SURVEYS.contains(survey)) {
      problems.add("SURVEY = " + survey + " must be one of " + new TreeSet<>(SURVEYS));
      survey = null;
    }
    return new ProposalFields(
        survey,
        problems.read(() -> h.string("PROJECT")),
        problems.read(() -> h.string("PI")),
        problems.read(() -> h.string("TITLE")));
  }

  private MembershipFields membership(HeaderValues h, Problems problems) {
    List<String> members = problems.read(() -> h.series("MBRCNT", "MBR"));
    List<String> subsystems = problems.read(() -> h.series("OBSCNT", "OBS"));
    return new MembershipFields(
        members == null ? List.of() : members, subsystems == null ? List.of() : subsystems);
  }

  private EnvironmentFields environment(HeaderValues h, String fileId, Problems problems) {
    Double seeing = problems.read(() -> h.number("SEEINGST"));
    if (seeing != null && !(seeing > 0.0)) {
      seeing = null;
    }
    Double humidity = clamped(fileId, "HUMSTART", problems.read(() -> h.number("HUMSTART")), 0.0, 100.0);
    Double elevation = clamped(fileId, "ELSTART", problems.read(() -> h.number("ELSTART")), 0.0, 90.0);
    return new EnvironmentFields(
        seeing,
        humidity,
        elevation,
        problems.read(() -> h.number("TAU225ST")),
        problems.read(() -> h.number("ATSTART")));
  }

  private static Double clamped(String fileId, String key, Double value, double min, double max) {
    if (value == null || value.isNaN()) {
      return null;
    }
    double result = Numbers.clamp(value, min, max);
    if (result != value) {
      log.warn("{}: {} = {} clamped to {}", Logs.value(fileId), key, value, result);
    }
    return result;
  }

  private InstrumentFields instrument(HeaderValues h, boolean external, Problems problems) {
    String obsType = problems.read(() -> h.lower("OBS_TYPE"));
    if (obsType != null && ObsTypes.NON_ASTRONOMICAL.contains(obsType)) {
      problems.add("OBS_TYPE = " + obsType + " contains no astronomical data");
    }
    String samMode = problems.read(() -> h.lower("SAM_MODE"));
    String inbeam = problems.read(() -> h.upper("INBEAM"));

    String frontend = problems.read(() -> h.upper("INSTRUME"));
    String backend = problems.read(() -> h.upper("BACKEND"));
    String instname = problems.read(() -> h.upper("INSTNAME"));
    if (instname != null) {
      if (instname.contains("SCUBA-2")) {
        frontend = "SCUBA-2";
        backend = "SCUBA-2";
      } else {
        String[] components = instname.split("-");
        if (components.length >= 2) {
          frontend = components[components.length - 2];
          backend = components[components.length - 1];
        }
      }
    }
    if ("SCUBA-2".equals(frontend) && backend == null) {
      backend = "SCUBA-2";
    }
    if (backend != null && !BACKENDS.contains(backend)) {
      problems.add("BACKEND = " + backend + " must be one of " + new TreeSet<>(BACKENDS));
      backend = null;
    }

    if (backend != null) {
      boolean continuum = "SCUBA-2".equals(backend);
      Set<String> obsTypes = continuum ? ObsTypes.CONTINUUM_OBS_TYPES : ObsTypes.HETERODYNE_OBS_TYPES;
      Set<String> samModes = continuum ? ObsTypes.CONTINUUM_SAM_MODES : ObsTypes.HETERODYNE_SAM_MODES;
      if (obsType != null && !obsTypes.contains(obsType)) {
        problems.add("OBS_TYPE = " + obsType + " is not permitted for " + backend);
      }
      if (samMode != null && !samModes.contains(samMode)) {
        problems.add("SAM_MODE = " + samMode + " is not permitted for " + backend);
      }
    }

    List<String> keywords = List.of();
    if (backend != null) {
      Map<String, String> candidates = new LinkedHashMap<>();
      candidates.put(InstrumentKeywords.INBEAM, inbeam);
      candidates.put(InstrumentKeywords.SWITCHING_MODE, problems.read(() -> h.string("SW_MODE")));
      candidates.put(InstrumentKeywords.SCAN_PATTERN, problems.read(() -> h.string("SCAN_PAT")));
      if (!"SCUBA-2".equals(backend)) {
        candidates.put(InstrumentKeywords.SIDEBAND, problems.read(() -> h.string("OBS_SB")));
        candidates.put(InstrumentKeywords.SIDEBAND_FILTER, problems.read(() -> h.string("SB_MODE")));
      }
      KeywordStrictness strictness = external ? KeywordStrictness.EXTERNAL : KeywordStrictness.STDPIPE;
      String myFrontend = frontend;
      String myBackend = backend;
      List<String> checked =
          problems.read(() -> InstrumentKeywords.keywords(strictness, myFrontend, myBackend, candidates));
      keywords = checked == null ? List.of() : checked;
    }

    String name = instname != null ? instname : InstrumentNames.name(frontend, backend, inbeam);
    return new InstrumentFields(
        name, frontend, backend, keywords, obsType, samMode, ObsTypes.archiveType(obsType, samMode));
  }

  private TargetFields target(HeaderValues h, InstrumentFields instrument, Problems problems) {
    String telescope = problems.read(() -> h.upper("TELESCOP"));
    if (telescope == null) {
      problems.add("TELESCOP is mandatory");
    } else if (!"JCMT".equals(telescope)) {
      problems.add("TELESCOP = " + telescope + " must be JCMT");
    }
    String object = problems.read(() -> h.string("OBJECT"));
    Double redshift = instrument.isContinuum() ? null : problems.read(() -> h.number("ZSOURCE"));
    String type = problems.read(() -> h.upper("TARGTYPE"));
    if (type != null && !TARGET_TYPES.contains(type)) {
      problems.add("TARGTYPE = " + type + " must be one of " + new TreeSet<>(TARGET_TYPES));
      type = null;
    }
    Boolean standard = problems.read(() -> h.bool("STANDARD"));
    Boolean movingFlag = problems.read(() -> h.bool("MOVING"));
    Double ra = problems.read(() -> h.number("OBSRA"));
    Double dec = problems.read(() -> h.number("OBSDEC"));
    boolean moving = Boolean.TRUE.equals(movingFlag) || ra == null || dec == null;
    return new TargetFields(
        object == null ? null : TargetNames.normalize(object),
        redshift,
        type == null ? null : type.toLowerCase(Locale.ROOT),
        standard,
        moving,
        moving ? null : ra,
        moving ? null : dec,
        telescope);
  }

  private ProductFields product(
      HeaderValues h, FileHeader header, InstrumentFields instrument, boolean external, Problems problems) {
    String product = problems.read(() -> h.lower("PRODUCT"));
    if (product == null) {
      problems.add("PRODUCT is mandatory");
    }
    String explicitProductId = problems.read(() -> h.string("PRODID"));
    if (external && explicitProductId == null) {
      problems.add("PRODID is mandatory for external collections");
    }
    String filter = problems.read(() -> h.string("FILTER"));
    Double restFrequency = restFrequency(h, problems);
    String subsystem = problems.read(() -> subsystemNumber(h));
    String bandwidthMode = problems.read(() -> h.string("BWMODE"));
    if (!external && product != null && instrument.backend() != null) {
      if (instrument.isContinuum()) {
        if (filter == null) {
          problems.add("FILTER is mandatory for SCUBA-2 products");
        }
      } else {
        if (restFrequency == null) {
          problems.add("RESTFRQ is mandatory for heterodyne products");
        }
        if (subsystem == null) {
          problems.add("SUBSYSNR is mandatory for heterodyne products");
        }
        if (bandwidthMode == null) {
          problems.add("BWMODE is mandatory for heterodyne products");
        }
      }
    }

    String calibrationLevel = problems.read(() -> h.lower("CALLEVEL"));
    if (calibrationLevel != null && !CALIBRATION_LEVELS.contains(calibrationLevel)) {
      problems.add("CALLEVEL = " + calibrationLevel + " must be one of "
          + new TreeSet<>(CALIBRATION_LEVELS));
      calibrationLevel = null;
    }

    String dataProductType = problems.read(() -> h.lower("DATAPROD"));
    if (dataProductType != null && !DATA_PRODUCT_TYPES.contains(dataProductType)) {
      problems.add("DATAPROD = " + dataProductType + " must be one of "
          + new TreeSet<>(DATA_PRODUCT_TYPES));
      dataProductType = null;
    }
    if (dataProductType == null) {
      dataProductType = problems.read(() -> inferDataProductType(h, product));
    }

    String productTypes = problems.read(() -> h.string("PRODTYPE"));
    if (productTypes != null) {
      problems.read(() -> ProductTypes.parse(productTypes));
    }

    String molecule = problems.read(() -> h.string("MOLECULE"));
    String transition = problems.read(() -> h.string("TRANSITI"));
    boolean hasLine = molecule != null && transition != null && !NO_LINE.equalsIgnoreCase(molecule);
    log.trace("{}: product {} data product type {}", header.fileId(), product, dataProductType);
    return new ProductFields(product, filter, restFrequency, subsystem, bandwidthMode,
        explicitProductId, calibrationLevel, dataProductType, productTypes,
        hasLine ? molecule : null, hasLine ? transition : null);
  }

  private static Double restFrequency(HeaderValues h, Problems problems) {
    Double restfreq = problems.read(() -> h.number("RESTFREQ"));
    if (restfreq != null) {
      return restfreq;
    }
    Double restwav = problems.read(() -> h.number("RESTWAV"));
    if (restwav != null && restwav > 0.0) {
      return SPEED_OF_LIGHT / restwav;
    }
    return problems.read(() -> h.number("RESTFRQ"));
  }

  private static String subsystemNumber(HeaderValues h) {
    if (!h.has("SUBSYSNR")) {
      return null;
    }
    Double value = h.number("SUBSYSNR");
    return Long.toString(Math.round(value));
  }

  private static String inferDataProductType(HeaderValues h, String product) {
    if (product != null && ScienceProduct.forProduct(product).map(ScienceProduct::isCatalog).orElse(false)) {
      return "catalog";
    }
    Long naxis = h.integer("NAXIS");
    if (naxis == null) {
      return null;
    }
    if (naxis == 1) {
      return "spectrum";
    }
    if (naxis == 2) {
      return "image";
    }
    Long naxis3 = h.integer("NAXIS3");
    return naxis3 != null && naxis3 > 1 ? "cube" : "image";
  }

  private ProvenanceFields provenance(
      HeaderValues h, String instream, ProductFields product, Problems problems) {
    String recipe = problems.read(() -> h.string("RECIPE"));
    if (recipe == null) {
      problems.add("RECIPE is mandatory");
    }
    String project = problems.read(() -> h.string("DPPROJ"));
    if (project == null && ArchiveCollections.JCMTLS.equals(instream)) {
      project = problems.read(() -> h.upper("SURVEY"));
    }
    if (project == null && product.product() != null) {
      project = ScienceProduct.forProduct(product.product()).map(ScienceProduct::pipelineProject).orElse(null);
    }
    String version = problems.read(() -> h.string("PROCVERS"));
    if (version == null) {
      String eng = problems.read(() -> h.string("ENGVERS"));
      String pipe = problems.read(() -> h.string("PIPEVERS"));
      if (eng != null && pipe != null) {
        version = "ENG:" + eng + " PIPE:" + pipe;
      }
    }
    String runId = problems.read(() -> normalizeRunId(h.string("DPRCINST")));
    if (runId == null) {
      problems.add("DPRCINST is mandatory");
    }
    Instant lastExecuted = problems.read(() -> h.instant("DPDATE"));
    if (lastExecuted == null) {
      problems.add("DPDATE is mandatory");
    }
    List<String> inputs = problems.read(() -> h.series("INPCNT", "INP"));
    List<String> files = problems.read(() -> h.series("PRVCNT", "PRV"));
    return new ProvenanceFields(
        recipe,
        project,
        problems.read(() -> h.string("REFERENC")),
        version,
        problems.read(() -> h.string("PRODUCER")),
        runId,
        lastExecuted,
        inputs,
        files);
  }

  /**
   * Normalizes a recipe-instance identifier: {@code jac-N} becomes {@code jac-%09d} and
   * hexadecimal values become their decimal representation.
   *
   * @param raw identifier as found in the header; may be {@code null}
   * @return normalized identifier or {@code null}
   */
  public static String normalizeRunId(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.strip();
    Matcher jac = JAC_RUN.matcher(trimmed);
    if (jac.matches()) {
      return String.format(Locale.ROOT, "jac-%09d", Long.parseLong(jac.group(1)));
    }
    Matcher hex = HEX_RUN.matcher(trimmed);
    if (hex.matches()) {
      return new BigInteger(hex.group(1), 16).toString();
    }
    return trimmed;
  }

  private static WcsInputs wcs(HeaderValues h, Problems problems) {
    Corners corners = problems.read(() -> corners(h));
    SubsystemRecord subsystem = problems.read(() -> subsystem(h));
    Double wavelength = null;
    String filter = problems.read(() -> h.string("FILTER"));
    if (filter != null) {
      try {
        wavelength = Double.valueOf(filter);
      } catch (NumberFormatException ex) {
        log.debug("FILTER {} is not a wavelength", filter);
      }
    }
    Double bandwidth = problems.read(() -> h.number("BANDWID"));
    Instant start = problems.read(() -> h.instant("DATE-OBS"));
    Instant end = problems.read(() -> h.instant("DATE-END"));
    if (start != null && end != null && end.isBefore(start)) {
      problems.add("DATE-END " + end + " precedes DATE-OBS " + start);
    }
    if (corners == null && subsystem == null && wavelength == null && start == null && end == null) {
      return WcsInputs.NONE;
    }
    return new WcsInputs(corners, subsystem, wavelength, bandwidth, start, end);
  }

  private static Corners corners(HeaderValues h) {
    String[] suffixes = {"BL", "BR", "TR", "TL"};
    Vec2[] points = new Vec2[suffixes.length];
    for (int i = 0; i < suffixes.length; i++) {
      Double ra = h.number("OBSRA" + suffixes[i]);
      Double dec = h.number("OBSDEC" + suffixes[i]);
      if (ra == null || dec == null) {
        return null;
      }
      points[i] = new Vec2(ra, dec);
    }
    return new Corners(points[0], points[1], points[2], points[3]);
  }

  private static SubsystemRecord subsystem(HeaderValues h) {
    Double restfrq = h.number("RESTFRQ");
    Double iffreq = h.number("IFFREQ");
    Double ifchansp = h.number("IFCHANSP");
    Double signalLow = h.number("FRQSIGLO");
    Double signalHigh = h.number("FRQSIGHI");
    if (restfrq == null || iffreq == null || ifchansp == null || signalLow == null || signalHigh == null) {
      return null;
    }
    Double imageLow = h.number("FRQIMGLO");
    Double imageHigh = h.number("FRQIMGHI");
    String sbMode = h.string("SB_MODE");
    SidebandMode mode;
    if (sbMode != null) {
      mode = SidebandMode.parse(sbMode);
    } else {
      mode = imageLow != null && imageHigh != null ? SidebandMode.DSB : SidebandMode.SSB;
    }
    return new SubsystemRecord(
        restfrq,
        iffreq,
        ifchansp,
        signalLow,
        signalHigh,
        imageLow == null ? Double.NaN : imageLow,
        imageHigh == null ? Double.NaN : imageHigh,
        mode);
  }

  private static CatalogFields catalog(FileHeader header, Problems problems) {
    Long count = header.extensionValues()
        .map(ext -> problems.read(() -> ext.integer("NAXIS2")))
        .orElse(null);
    Double area = header.mocAreaSqDeg();
    if (count == null && area == null) {
      return CatalogFields.NONE;
    }
    return new CatalogFields(count, area);
  }

  /** Accumulates problems so that a header is reported in one pass. */
  private static final class Problems {
    private final List<String> list = new ArrayList<>();

    void add(String problem) {
      list.add(problem);
    }

    void require(HeaderValues h, String key) {
      if (!h.has(key)) {
        list.add(key + " is mandatory");
      }
    }

    <T> T read(Supplier<T> reader) {
      try {
        return reader.get();
      } catch (IllegalArgumentException ex) {
        list.add(ex.getMessage());
        return null;
      }
    }

    boolean isEmpty() {
      return list.isEmpty();
    }

    List<String> list() {
      return list;
    }
  }
}
