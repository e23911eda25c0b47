/**
 * Observatory vocabularies: collections, product families and ids, instrument names and
 * keywords, observation types, intents and file ids.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain.naming;
