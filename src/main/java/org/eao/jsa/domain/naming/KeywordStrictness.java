package org.eao.jsa.domain.naming;

/**
 * How strictly instrument keywords are checked.
 *
 * @since 0.1.0
 */
public enum KeywordStrictness {
  /** Every missing or invalid keyword is an error. */
  RAW,
  /** Keywords that processing may legitimately drop can be missing. */
  STDPIPE,
  /** Invalid values are errors, missing keywords are ignored. */
  EXTERNAL
}
