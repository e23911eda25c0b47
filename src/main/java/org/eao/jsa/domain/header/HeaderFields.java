package org.eao.jsa.domain.header;

import java.util.Objects;

/**
 * <strong>What:</strong> The typed field set extracted from one file header.
 * <p><strong>Role:</strong> Output of header extraction; input of identifier resolution,
 * membership and provenance resolution and WCS building.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param fileId archive file id
 * @param fileName original file name
 * @param instream collection named by the file ({@code INSTREAM})
 * @param associationType {@code ASN_TYPE}, defaulting to {@code custom}
 * @param observationIdHeader {@code OBSID}, or {@code null}
 * @param associationId {@code ASN_ID}, or {@code null}
 * @since 0.1.0
 */
public record HeaderFields(
    String fileId,
    String fileName,
    String instream,
    String associationType,
    String observationIdHeader,
    String associationId,
    ProposalFields proposal,
    MembershipFields membership,
    EnvironmentFields environment,
    InstrumentFields instrument,
    TargetFields target,
    ProductFields product,
    ProvenanceFields provenance,
    WcsInputs wcs,
    CatalogFields catalog) {

  public HeaderFields {
    Objects.requireNonNull(fileId, "fileId");
    Objects.requireNonNull(instream, "instream");
    Objects.requireNonNull(associationType, "associationType");
  }
}
