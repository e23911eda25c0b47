/**
 * Header sources reading per-file metadata dumps.
 *
 * @since 0.1.0
 */
package org.eao.jsa.infrastructure.header;
