package org.eao.jsa.application.ingest;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.eao.jsa.application.port.ArchiveQueryPort;
import org.eao.jsa.application.port.ArchiveQueryPort.ProposalInfo;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.error.ValidationException;
import org.eao.jsa.domain.header.CatalogFields;
import org.eao.jsa.domain.header.EnvironmentFields;
import org.eao.jsa.domain.header.HeaderFields;
import org.eao.jsa.domain.header.InstrumentFields;
import org.eao.jsa.domain.header.ProductFields;
import org.eao.jsa.domain.header.ProposalFields;
import org.eao.jsa.domain.header.ProvenanceFields;
import org.eao.jsa.domain.header.TargetFields;
import org.eao.jsa.domain.header.WcsInputs;
import org.eao.jsa.domain.metadict.FileContribution;
import org.eao.jsa.domain.metadict.FitsUriSection;
import org.eao.jsa.domain.metadict.PlaneKeys;
import org.eao.jsa.domain.naming.ArchiveCollections;
import org.eao.jsa.domain.naming.Intents;
import org.eao.jsa.domain.naming.ProductTypes;
import org.eao.jsa.domain.naming.ScienceProduct;
import org.eao.jsa.domain.wcs.SpatialWcs;

/**
 * <strong>What:</strong> Converts the typed header of one file into the plane dictionary entries,
 * per-URI sections and sets that the aggregator folds into the metadict.
 * <p><strong>Why:</strong> Keeps the keyword-to-attribute mapping in one place so that the
 * aggregator only deals with merge rules.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; proposal lookups are cached in the session.</p>
 *
 * @since 0.1.0
 */
public final class ContributionBuilder {
  /** Archive name used in artifact URIs. */
  public static final String ARCHIVE = "JCMT";

  private static final String DEFAULT_PRODUCT_TYPES = "auxiliary";

  private final ArchiveQueryPort archive;
  private final AggregationSession session;
  private final MetricsPort metrics;

  public ContributionBuilder(ArchiveQueryPort archive, AggregationSession session, MetricsPort metrics) {
    this.archive = Objects.requireNonNull(archive, "archive");
    this.session = Objects.requireNonNull(session, "session");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /** Artifact URI of a file in the archive. */
  public static String artifactUri(String fileId) {
    return "ad:" + ARCHIVE + "/" + fileId;
  }

  /** URI of one FITS extension of a file. */
  public static String extensionUri(String artifactUri, int extension) {
    return artifactUri + "#" + extension;
  }

  /**
   * Builds the contribution of one file.
   *
   * @param fields validated header values
   * @param identity plane receiving the file
   * @param members resolved members of the file
   * @param inputs provenance inputs after the first pass
   * @return contribution ready to be folded
   * @throws ValidationException when a conditionally mandatory value is missing
   * @throws StoreException when a proposal lookup fails
   */
  public FileContribution build(
      HeaderFields fields, PlaneIdentity identity, MembershipResult members, ProvenanceInputs inputs)
      throws ValidationException, StoreException {
    SortedMap<String, String> dict = new TreeMap<>();
    dict.put(PlaneKeys.ALGORITHM, identity.algorithm());

    putProposal(dict, fields.proposal());
    if (IdentifierResolver.EXPOSURE.equals(identity.algorithm()) || members.size() <= 1) {
      putEnvironment(dict, fields.environment());
    }
    putInstrument(dict, fields.instrument());
    putTarget(dict, fields.target());
    putRelease(dict, fields, identity, members);
    putProduct(dict, fields, identity);
    putProvenance(dict, fields.provenance());

    String artifactUri = artifactUri(fields.fileId());
    Map<String, FitsUriSection> sections = sections(fields, artifactUri);
    FitsUriSection fileSection = sections.computeIfAbsent(artifactUri, ignored -> new FitsUriSection());
    if (fields.wcs() != WcsInputs.NONE) {
      fileSection.setWcsInputs(fields.wcs());
    }
    if (identity.mainProduct() && !IdentifierResolver.EXPOSURE.equals(identity.algorithm())) {
      fileSection.memberTimes().putAll(members.intervals());
    }

    Map<String, String> custom = new TreeMap<>();
    CatalogFields catalog = fields.catalog();
    if (catalog.areaSqDeg() != null) {
      custom.put(PlaneKeys.CUSTOM_AREA, Double.toString(catalog.areaSqDeg()));
    }
    if (catalog.sourceCount() != null) {
      custom.put(PlaneKeys.CUSTOM_SOURCE_COUNT, Long.toString(catalog.sourceCount()));
    }
    Double density = catalog.sourceDensity();
    if (density != null) {
      dict.put(PlaneKeys.SOURCE_DENSITY, Double.toString(density));
    }

    boolean recordInputs = identity.mainProduct();
    return new FileContribution(
        fields.fileId(),
        identity.observationId(),
        identity.productId(),
        dict,
        members.members(),
        recordInputs ? inputs.planes() : Set.of(),
        recordInputs ? inputs.pendingFiles() : Set.of(),
        artifactUri,
        Path.of(fields.fileName()),
        sections,
        custom);
  }

  private void putProposal(SortedMap<String, String> dict, ProposalFields proposal) throws StoreException {
    put(dict, PlaneKeys.PROPOSAL_PROJECT, proposal.project());
    put(dict, PlaneKeys.PROPOSAL_ID, proposal.id());
    String pi = proposal.pi();
    String title = proposal.title();
    if (proposal.id() != null && (pi == null || title == null)) {
      Optional<ProposalInfo> info = proposalInfo(proposal.id());
      if (info.isPresent()) {
        pi = pi == null ? info.get().pi() : pi;
        title = title == null ? info.get().title() : title;
      }
    }
    put(dict, PlaneKeys.PROPOSAL_PI, pi);
    put(dict, PlaneKeys.PROPOSAL_TITLE, title);
  }

  private Optional<ProposalInfo> proposalInfo(String proposalId) throws StoreException {
    Optional<ProposalInfo> cached = session.proposals().get(proposalId);
    if (cached != null) {
      return cached;
    }
    metrics.increment("ingest.queries");
    Optional<ProposalInfo> info = archive.proposal(proposalId);
    session.proposals().put(proposalId, info);
    return info;
  }

  private static void putEnvironment(SortedMap<String, String> dict, EnvironmentFields env) {
    put(dict, PlaneKeys.ENV_SEEING, env.seeing());
    put(dict, PlaneKeys.ENV_HUMIDITY, env.humidity());
    put(dict, PlaneKeys.ENV_ELEVATION, env.elevation());
    if (env.tau() != null) {
      put(dict, PlaneKeys.ENV_TAU, env.tau());
      put(dict, PlaneKeys.ENV_WAVELENGTH_TAU, HeaderExtractor.SPEED_OF_LIGHT / 225.0e9);
    }
    put(dict, PlaneKeys.ENV_AMBIENT_TEMP, env.ambientTemperature());
  }

  private static void putInstrument(SortedMap<String, String> dict, InstrumentFields instrument) {
    put(dict, PlaneKeys.OBS_TYPE, instrument.archiveObsType());
    if (instrument.jcmtObsType() != null) {
      put(dict, PlaneKeys.OBS_INTENT, Intents.intent(instrument.jcmtObsType(), instrument.backend()));
    }
    put(dict, PlaneKeys.INSTRUMENT_NAME, instrument.name());
    if (!instrument.keywords().isEmpty()) {
      put(dict, PlaneKeys.INSTRUMENT_KEYWORDS, String.join(" ", instrument.keywords()));
    }
  }

  private static void putTarget(SortedMap<String, String> dict, TargetFields target) {
    put(dict, PlaneKeys.TELESCOPE_NAME, target.telescope());
    if (target.name() == null) {
      return;
    }
    put(dict, PlaneKeys.TARGET_NAME, target.name());
    put(dict, PlaneKeys.TARGET_TYPE, target.type());
    put(dict, PlaneKeys.TARGET_REDSHIFT, target.redshift());
    if (target.standard() != null) {
      put(dict, PlaneKeys.TARGET_STANDARD, target.standard() ? "TRUE" : "FALSE");
    }
    put(dict, PlaneKeys.TARGET_MOVING, target.moving() ? "TRUE" : "FALSE");
    if (!target.moving()) {
      put(dict, PlaneKeys.TARGET_POSITION_COORDSYS, SpatialWcs.COORDSYS);
      put(dict, PlaneKeys.TARGET_POSITION_EQUINOX, SpatialWcs.EQUINOX);
      put(dict, PlaneKeys.TARGET_POSITION_RA, target.ra());
      put(dict, PlaneKeys.TARGET_POSITION_DEC, target.dec());
    }
  }

  private static void putRelease(
      SortedMap<String, String> dict, HeaderFields fields, PlaneIdentity identity, MembershipResult members)
      throws ValidationException {
    if (!ArchiveCollections.JCMT.equals(fields.instream())) {
      return;
    }
    Optional<ScienceProduct> family = ScienceProduct.forProduct(identity.scienceProduct());
    if (family.isEmpty() || (family.get() != ScienceProduct.REDUCED && family.get() != ScienceProduct.CUBE)) {
      return;
    }
    if (members.latestRelease() == null) {
      throw new ValidationException(fields.fileId(),
          "no release date could be derived from the members of " + identity.productId());
    }
    String release = members.latestRelease().toString();
    dict.put(PlaneKeys.OBS_META_RELEASE, release);
    dict.put(PlaneKeys.PLANE_META_RELEASE, release);
    dict.put(PlaneKeys.PLANE_DATA_RELEASE, release);
  }

  private static void putProduct(SortedMap<String, String> dict, HeaderFields fields, PlaneIdentity identity)
      throws ValidationException {
    ProductFields product = fields.product();
    put(dict, PlaneKeys.ENERGY_SPECIES, product.species());
    put(dict, PlaneKeys.ENERGY_TRANSITION, product.transition());
    if (fields.instrument().isContinuum() && product.filter() != null) {
      put(dict, PlaneKeys.ENERGY_BANDPASS, "SCUBA-2-" + product.filter() + "um");
    }
    if (!identity.mainProduct()) {
      return;
    }
    put(dict, PlaneKeys.DATA_PRODUCT_TYPE, product.dataProductType());
    if (ArchiveCollections.isExternal(fields.instream())) {
      if (product.calibrationLevel() == null) {
        throw new ValidationException(fields.fileId(), "CALLEVEL is mandatory for external products");
      }
      dict.put(PlaneKeys.CALIBRATION_LEVEL, "calibrated".equals(product.calibrationLevel()) ? "2" : "3");
    } else {
      ScienceProduct.forProduct(identity.scienceProduct()).ifPresent(
          family -> dict.put(PlaneKeys.CALIBRATION_LEVEL, Integer.toString(family.pipelineCalibrationLevel())));
    }
  }

  private static void putProvenance(SortedMap<String, String> dict, ProvenanceFields provenance) {
    put(dict, PlaneKeys.PROVENANCE_NAME, provenance.recipe());
    put(dict, PlaneKeys.PROVENANCE_PROJECT, provenance.project());
    put(dict, PlaneKeys.PROVENANCE_REFERENCE, provenance.reference());
    put(dict, PlaneKeys.PROVENANCE_VERSION, provenance.version());
    put(dict, PlaneKeys.PROVENANCE_PRODUCER, provenance.producer());
    put(dict, PlaneKeys.RUN_ID, provenance.runId());
    if (provenance.lastExecuted() != null) {
      put(dict, PlaneKeys.PROVENANCE_LAST_EXECUTED, provenance.lastExecuted().toString());
    }
  }

  private static Map<String, FitsUriSection> sections(HeaderFields fields, String artifactUri) {
    String declaration = fields.product().productTypes();
    if (declaration == null) {
      declaration = ScienceProduct.forProduct(fields.product().product())
          .map(family -> family.defaultProductTypes(fields.product().product()))
          .orElse(DEFAULT_PRODUCT_TYPES);
    }
    ProductTypes types = ProductTypes.parse(declaration);
    Map<String, FitsUriSection> sections = new LinkedHashMap<>();
    FitsUriSection fileSection = new FitsUriSection();
    sections.put(artifactUri, fileSection);
    if (types.extensions().isEmpty()) {
      fileSection.attributes().put(FitsUriSection.ARTIFACT_PRODUCT_TYPE, types.fileDefault());
      return sections;
    }
    for (Map.Entry<Integer, String> entry : types.extensions().entrySet()) {
      FitsUriSection section = new FitsUriSection();
      section.attributes().put(FitsUriSection.PART_PRODUCT_TYPE, entry.getValue());
      sections.put(extensionUri(artifactUri, entry.getKey()), section);
    }
    String primary = types.extensions().values().iterator().next();
    fileSection.attributes().put(FitsUriSection.ARTIFACT_PRODUCT_TYPE, primary);
    if (types.fileDefault() != null) {
      fileSection.attributes().put(FitsUriSection.PART_PRODUCT_TYPE, types.fileDefault());
    }
    return sections;
  }

  private static void put(SortedMap<String, String> dict, String key, String value) {
    if (value != null) {
      dict.put(key, value);
    }
  }

  private static void put(SortedMap<String, String> dict, String key, Double value) {
    if (value != null && !value.isNaN()) {
      dict.put(key, Double.toString(value));
    }
  }
}
