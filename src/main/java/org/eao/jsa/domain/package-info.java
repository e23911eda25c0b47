/**
 * Domain model of JCMT Science Archive ingestion.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain;
