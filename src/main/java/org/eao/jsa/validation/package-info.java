/**
 * Input validation helpers shared by the CLI, configuration and header layers.
 *
 * @since 0.1.0
 */
package org.eao.jsa.validation;
