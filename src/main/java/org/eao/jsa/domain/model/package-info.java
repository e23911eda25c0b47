/**
 * The archived record model: observations, planes, artifacts, parts and chunks.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain.model;
