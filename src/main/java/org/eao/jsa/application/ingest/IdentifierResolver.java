package org.eao.jsa.application.ingest;

import java.util.Objects;
import java.util.Optional;
import org.eao.jsa.domain.error.IdentifierException;
import org.eao.jsa.domain.header.HeaderFields;
import org.eao.jsa.domain.header.ProductFields;
import org.eao.jsa.domain.naming.ArchiveCollections;
import org.eao.jsa.domain.naming.ProductIds;
import org.eao.jsa.domain.naming.ScienceProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the observation id, algorithm and product id of a file.
 *
 * <p>Single observations ({@code ASN_TYPE = obs}) use the {@code exposure} algorithm and the
 * {@code OBSID} keyword; every other association uses {@code ASN_TYPE} as the algorithm name and
 * {@code ASN_ID} as the observation id. Pipeline products get a generated product id, external
 * collections must supply {@code PRODID}. In the JCMT collection a {@code PRODID} that disagrees
 * with the generated id is reported and ignored.
 */
public final class IdentifierResolver {
  private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);
  public static final String EXPOSURE = "exposure";

  private final String collection;

  public IdentifierResolver(String collection) {
    this.collection = Objects.requireNonNull(collection, "collection");
  }

  /**
   * @param fields validated header values
   * @return identity of the plane receiving the file
   * @throws IdentifierException when the identifiers cannot be derived
   */
  public PlaneIdentity resolve(HeaderFields fields) throws IdentifierException {
    Objects.requireNonNull(fields, "fields");
    String algorithm;
    String observationId;
    if ("obs".equals(fields.associationType())) {
      algorithm = EXPOSURE;
      observationId = require(fields.observationIdHeader(), "OBSID", fields);
    } else {
      algorithm = fields.associationType();
      observationId = require(fields.associationId(), "ASN_ID", fields);
    }

    ProductFields product = fields.product();
    String productName = require(product.product(), "PRODUCT", fields);
    if (ArchiveCollections.isExternal(fields.instream())) {
      String productId = require(product.explicitProductId(), "PRODID", fields);
      String scienceProduct = externalScienceProduct(productName, productId);
      return new PlaneIdentity(collection, algorithm, observationId, productId, scienceProduct,
          productName.equals(scienceProduct));
    }

    Optional<ScienceProduct> family = ScienceProduct.forProduct(productName);
    if (family.isEmpty()) {
      throw new IdentifierException(
          fields.fileId() + ": PRODUCT = " + productName + " is not a recognised pipeline product");
    }
    String token = family.get().token();
    String productId;
    if (fields.instrument().isContinuum()) {
      productId = ProductIds.continuum(token, product.filter());
    } else {
      productId = ProductIds.heterodyne(
          token, product.restFrequencyHz(), product.bandwidthMode(), product.subsystemNumber());
    }
    if (product.explicitProductId() != null && !product.explicitProductId().equals(productId)) {
      log.warn("{}: PRODID = {} does not match {}", fields.fileId(), product.explicitProductId(), productId);
    }
    return new PlaneIdentity(collection, algorithm, observationId, productId, token,
        productName.equals(token));
  }

  /**
   * Science product of an external plane: the pipeline family when {@code PRODUCT} names one,
   * the product itself when {@code PRODID} starts with it, otherwise the text of {@code PRODID}
   * before its first hyphen.
   */
  private static String externalScienceProduct(String productName, String productId) {
    Optional<ScienceProduct> family = ScienceProduct.forProduct(productName);
    if (family.isPresent() && productId.startsWith(family.get().token())) {
      return family.get().token();
    }
    if (productId.equals(productName) || productId.startsWith(productName + "-")) {
      return productName;
    }
    return ProductIds.scienceProductOf(productId);
  }

  private static String require(String value, String keyword, HeaderFields fields)
      throws IdentifierException {
    if (value == null || value.isBlank()) {
      throw new IdentifierException(fields.fileId() + ": " + keyword + " is required to identify the plane");
    }
    return value;
  }
}
